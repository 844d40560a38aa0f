package io.surfworks.dnnforge.core.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Application of one {@link Operator} to an ordered list of inputs.
 *
 * <p>Nodes are created only through {@link #create}, which runs the operator's
 * validation before anything is allocated, so a rejected construction never
 * leaves a partial node behind. Inputs change only through
 * {@link OperationGraph#replace}.
 */
public final class Node {

    private final Operator operator;
    private final Value[] inputs;
    private final List<Value> outputs;

    private Node(Operator operator, List<Value> inputs, List<ValueType> outputTypes) {
        this.operator = operator;
        this.inputs = inputs.toArray(new Value[0]);
        List<Value> outs = new ArrayList<>(outputTypes.size());
        for (int i = 0; i < outputTypes.size(); i++) {
            outs.add(new Value(outputTypes.get(i), this, i, null));
        }
        this.outputs = Collections.unmodifiableList(outs);
    }

    /**
     * Validates and creates a node.
     */
    public static Node create(Operator operator, List<Value> inputs) {
        for (int i = 0; i < inputs.size(); i++) {
            if (inputs.get(i) == null) {
                throw new IllegalArgumentException(operator.kind() + ": input " + i + " is null");
            }
        }
        List<ValueType> types = operator.outputTypes(List.copyOf(inputs));
        return new Node(operator, inputs, types);
    }

    public Operator operator() {
        return operator;
    }

    public List<Value> inputs() {
        return List.of(inputs);
    }

    public Value input(int i) {
        return inputs[i];
    }

    /**
     * Rewires one input. Only {@link OperationGraph} calls this, after checking
     * that the replacement has a compatible type.
     */
    void setInput(int i, Value value) {
        inputs[i] = value;
    }

    public List<Value> outputs() {
        return outputs;
    }

    /**
     * The first output.
     */
    public Value output() {
        return outputs.get(0);
    }

    public boolean is(OperatorKind kind) {
        return operator.kind().equals(kind);
    }

    @Override
    public String toString() {
        return operator + Arrays.toString(inputs);
    }
}
