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
import io.surfworks.dnnforge.core.graph.ShapeInferring;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.graph.ValueType;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * Reorders axes, inserts size-1 axes ({@link #NEW_AXIS}) and drops size-1 axes.
 *
 * <p>{@code new DimShuffle(List.of(1, 0, 2, 3))} swaps the first two axes;
 * {@code new DimShuffle(List.of(0, 1, NEW_AXIS, NEW_AXIS))} turns a matrix into
 * a rank-4 tensor.
 */
public record DimShuffle(List<Integer> pattern) implements Operator, Executable, ShapeInferring, Differentiable {

    public static final OperatorKind KIND = OperatorKind.of("generic", "dimshuffle");
    public static final int NEW_AXIS = -1;

    public DimShuffle {
        pattern = List.copyOf(pattern);
    }

    public static DimShuffle of(Integer... pattern) {
        return new DimShuffle(List.of(pattern));
    }

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        if (inputs.size() != 1) {
            throw new ShapeException("DimShuffle takes one input, got " + inputs.size());
        }
        TensorType t = inputs.get(0).tensorType();
        boolean[] used = new boolean[t.rank()];
        for (int axis : pattern) {
            if (axis == NEW_AXIS) {
                continue;
            }
            if (axis < 0 || axis >= t.rank() || used[axis]) {
                throw new ShapeException("DimShuffle pattern " + pattern + " is invalid for " + t);
            }
            used[axis] = true;
        }
        for (int axis = 0; axis < t.rank(); axis++) {
            if (!used[axis] && t.isKnown(axis) && t.dim(axis) != 1) {
                throw new ShapeException("DimShuffle pattern " + pattern + " drops axis " + axis
                        + " of size " + t.dim(axis));
            }
        }
        return List.of(t.withShape(apply(t.shape())));
    }

    private List<Integer> apply(List<Integer> shape) {
        List<Integer> out = new ArrayList<>(pattern.size());
        for (int axis : pattern) {
            out.add(axis == NEW_AXIS ? 1 : shape.get(axis));
        }
        return out;
    }

    /**
     * The pattern that undoes this one on a tensor of the output shape.
     */
    public DimShuffle inverse(int inputRank) {
        List<Integer> inverse = new ArrayList<>(inputRank);
        for (int axis = 0; axis < inputRank; axis++) {
            int position = pattern.indexOf(axis);
            inverse.add(position >= 0 ? position : NEW_AXIS);
        }
        return new DimShuffle(inverse);
    }

    @Override
    public List<List<Integer>> inferShape(Node node, List<List<Integer>> inputShapes) {
        return List.of(apply(inputShapes.get(0)));
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        return List.of(((Tensor) inputs.get(0)).dimShuffle(pattern));
    }

    @Override
    public List<Value> grad(Node node, List<Value> outputGrads) {
        return List.of(inverse(node.input(0).tensorType().rank()).call(outputGrads.get(0)));
    }
}
