package io.surfworks.dnnforge.core.grad;

import java.util.List;

import io.surfworks.dnnforge.core.exec.ExecutionContext;
import io.surfworks.dnnforge.core.exec.Executable;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.Operator;
import io.surfworks.dnnforge.core.graph.OperatorKind;
import io.surfworks.dnnforge.core.graph.ShapeException;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.graph.ValueType;

/**
 * Placeholder standing in for a gradient an operator does not implement.
 * Typed like the input it is the gradient of; fails if it is ever executed.
 */
public record GradNotImplemented(String reason) implements Operator, Executable {

    public static final OperatorKind KIND = OperatorKind.of("grad", "not_implemented");

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        if (inputs.size() != 1) {
            throw new ShapeException("GradNotImplemented takes one input, got " + inputs.size());
        }
        return List.of(inputs.get(0).type());
    }

    @Override
    public boolean constantFoldable() {
        return false;
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        throw new GradientNotImplementedException(reason);
    }
}
