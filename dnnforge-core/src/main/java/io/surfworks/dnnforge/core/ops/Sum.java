package io.surfworks.dnnforge.core.ops;

import java.util.ArrayList;
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
 * Sum over some axes (all of them when {@code axes} is empty).
 */
public record Sum(List<Integer> axes, boolean keepDims) implements Operator, Executable, Differentiable {

    public static final OperatorKind KIND = OperatorKind.of("generic", "sum");

    public Sum {
        axes = List.copyOf(axes);
    }

    /**
     * Sum of every element, as a rank-0 value.
     */
    public static Value all(Value x) {
        return new Sum(List.of(), false).call(x);
    }

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    private boolean reduces(int axis) {
        return axes.isEmpty() || axes.contains(axis);
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        if (inputs.size() != 1) {
            throw new ShapeException("Sum takes one input, got " + inputs.size());
        }
        TensorType t = inputs.get(0).tensorType();
        for (int axis : axes) {
            if (axis < 0 || axis >= t.rank()) {
                throw new ShapeException("Sum axis " + axis + " out of range for " + t);
            }
        }
        List<Integer> shape = new ArrayList<>();
        for (int axis = 0; axis < t.rank(); axis++) {
            if (!reduces(axis)) {
                shape.add(t.dim(axis));
            } else if (keepDims) {
                shape.add(1);
            }
        }
        return List.of(t.withShape(shape));
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        Tensor x = (Tensor) inputs.get(0);
        int[] full = x.shape();
        int[] kept = new int[full.length];
        for (int axis = 0; axis < full.length; axis++) {
            kept[axis] = reduces(axis) ? 1 : full[axis];
        }
        Tensor acc = Tensor.zeros(x.dtype(), kept);
        int[] target = new int[full.length];
        Tensor.forEachIndex(full, idx -> {
            for (int axis = 0; axis < idx.length; axis++) {
                target[axis] = reduces(axis) ? 0 : idx[axis];
            }
            acc.accumulate(x.get(idx), target);
        });
        if (keepDims) {
            return List.of(acc);
        }
        List<Integer> squeeze = new ArrayList<>();
        for (int axis = 0; axis < full.length; axis++) {
            if (!reduces(axis)) {
                squeeze.add(axis);
            }
        }
        return List.of(acc.dimShuffle(squeeze).copy());
    }

    @Override
    public List<Value> grad(Node node, List<Value> outputGrads) {
        Value x = node.input(0);
        Value g = outputGrads.get(0);
        int rank = x.tensorType().rank();
        if (!keepDims && rank > 0) {
            List<Integer> pattern = new ArrayList<>(rank);
            int position = 0;
            for (int axis = 0; axis < rank; axis++) {
                pattern.add(reduces(axis) ? DimShuffle.NEW_AXIS : position++);
            }
            if (g.tensorType().rank() > 0 || pattern.stream().anyMatch(p -> p != DimShuffle.NEW_AXIS)) {
                g = new DimShuffle(pattern).call(g);
            }
        }
        return List.of(Elemwise.mul(FillLike.onesLike(x), g));
    }
}
