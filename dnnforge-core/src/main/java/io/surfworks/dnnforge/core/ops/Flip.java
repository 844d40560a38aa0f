package io.surfworks.dnnforge.core.ops;

import java.util.List;

import io.surfworks.dnnforge.core.exec.ExecutionContext;
import io.surfworks.dnnforge.core.exec.Executable;
import io.surfworks.dnnforge.core.graph.Differentiable;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.Operator;
import io.surfworks.dnnforge.core.graph.OperatorKind;
import io.surfworks.dnnforge.core.graph.ShapeException;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.graph.ValueType;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * Reverses the given axes ({@code x[:, :, ::-1, ::-1]} for axes 2 and 3).
 */
public record Flip(List<Integer> axes) implements Operator, Executable, Differentiable {

    public static final OperatorKind KIND = OperatorKind.of("generic", "flip");

    public Flip {
        axes = List.copyOf(axes);
    }

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        if (inputs.size() != 1) {
            throw new ShapeException("Flip takes one input, got " + inputs.size());
        }
        TensorType t = inputs.get(0).tensorType();
        for (int axis : axes) {
            if (axis < 0 || axis >= t.rank()) {
                throw new ShapeException("Flip axis " + axis + " out of range for " + t);
            }
        }
        return List.of(t);
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        int[] a = axes.stream().mapToInt(Integer::intValue).toArray();
        return List.of(((Tensor) inputs.get(0)).flip(a));
    }

    @Override
    public List<Value> grad(Node node, List<Value> outputGrads) {
        return List.of(call(outputGrads.get(0)));
    }
}
