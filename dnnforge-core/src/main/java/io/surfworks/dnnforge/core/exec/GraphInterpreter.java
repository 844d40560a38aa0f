package io.surfworks.dnnforge.core.exec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.surfworks.dnnforge.core.graph.Aliasing;
import io.surfworks.dnnforge.core.graph.Constant;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.graph.ShapeException;
import io.surfworks.dnnforge.core.graph.ShapeInferring;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * Evaluates an {@link OperationGraph} node by node in topological order.
 *
 * <p>After every node, shapes inferred by {@link ShapeInferring} operators are
 * checked against the materialized outputs, and statically known output
 * dimensions are checked against the node's declared types.
 *
 * <p>An input named in an {@link Aliasing} operator's destroy map is
 * overwritten by that node; reading it again afterwards is an error.
 */
public final class GraphInterpreter {

    private GraphInterpreter() {
    }

    /**
     * Runs the graph and returns one runtime value per graph output.
     *
     * @param graph the graph to run
     * @param inputs runtime values for every graph input
     * @param context services and resource cache for this execution
     */
    public static List<Object> evaluate(OperationGraph graph, Map<Value, ?> inputs, ExecutionContext context) {
        Map<Value, Object> env = new HashMap<>();
        Set<Value> destroyed = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Value input : graph.inputs()) {
            if (!inputs.containsKey(input)) {
                throw new IllegalArgumentException("Missing runtime value for graph input " + input);
            }
            Object runtime = inputs.get(input);
            checkDeclaredType(input, runtime);
            env.put(input, runtime);
        }

        for (Node node : graph.nodes()) {
            if (!(node.operator() instanceof Executable executable)) {
                throw new UnsupportedOperationException(node.operator().kind() + " cannot be executed");
            }
            List<Object> args = new ArrayList<>(node.inputs().size());
            for (Value in : node.inputs()) {
                args.add(lookup(env, in, destroyed));
            }
            List<Object> results = executable.perform(node, args, context);
            if (node.operator() instanceof Aliasing aliasing) {
                for (int destroyedInput : aliasing.destroyMap().values()) {
                    destroyed.add(node.input(destroyedInput));
                }
            }
            if (results.size() != node.outputs().size()) {
                throw new IllegalStateException(node.operator().kind() + " produced " + results.size()
                        + " outputs, expected " + node.outputs().size());
            }
            checkInferredShapes(node, args, results);
            for (int i = 0; i < results.size(); i++) {
                checkDeclaredType(node.outputs().get(i), results.get(i));
                env.put(node.outputs().get(i), results.get(i));
            }
        }

        List<Object> outputs = new ArrayList<>();
        for (Value output : graph.outputs()) {
            outputs.add(lookup(env, output, destroyed));
        }
        return outputs;
    }

    /**
     * Runs a single-output graph and returns the output tensor.
     */
    public static Tensor evaluateTensor(OperationGraph graph, Map<Value, ?> inputs, ExecutionContext context) {
        List<Object> outputs = evaluate(graph, inputs, context);
        if (outputs.size() != 1 || !(outputs.get(0) instanceof Tensor tensor)) {
            throw new IllegalStateException("Expected a single tensor output, got " + outputs);
        }
        return tensor;
    }

    private static Object lookup(Map<Value, Object> env, Value value, Set<Value> destroyed) {
        if (destroyed.contains(value)) {
            throw new IllegalStateException(value + " was overwritten in place and read again");
        }
        if (value instanceof Constant constant) {
            return constant.data();
        }
        Object runtime = env.get(value);
        if (runtime == null) {
            throw new IllegalStateException("No runtime value computed for " + value);
        }
        return runtime;
    }

    private static void checkDeclaredType(Value value, Object runtime) {
        if (!(value.type() instanceof TensorType type)) {
            return;
        }
        if (!(runtime instanceof Tensor tensor)) {
            throw new ShapeException("Expected a tensor for " + value + ", got " + runtime);
        }
        if (tensor.rank() != type.rank()) {
            throw new ShapeException("Rank mismatch for " + value + ": runtime shape "
                    + Arrays.toString(tensor.shape()));
        }
        for (int i = 0; i < type.rank(); i++) {
            if (type.isKnown(i) && type.dim(i) != tensor.dim(i)) {
                throw new ShapeException("Shape mismatch for " + value + ": runtime shape "
                        + Arrays.toString(tensor.shape()));
            }
        }
    }

    private static void checkInferredShapes(Node node, List<Object> args, List<Object> results) {
        if (!(node.operator() instanceof ShapeInferring inferring)) {
            return;
        }
        List<List<Integer>> inputShapes = new ArrayList<>(args.size());
        for (Object arg : args) {
            inputShapes.add(arg instanceof Tensor t ? toList(t.shape()) : null);
        }
        List<List<Integer>> inferred = inferring.inferShape(node, inputShapes);
        for (int i = 0; i < results.size(); i++) {
            if (results.get(i) instanceof Tensor t && !inferred.get(i).equals(toList(t.shape()))) {
                throw new IllegalStateException(node.operator().kind() + " inferred shape " + inferred.get(i)
                        + " but produced " + Arrays.toString(t.shape()));
            }
        }
    }

    private static List<Integer> toList(int[] shape) {
        return Arrays.stream(shape).boxed().toList();
    }
}
