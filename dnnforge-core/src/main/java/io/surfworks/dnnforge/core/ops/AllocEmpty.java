package io.surfworks.dnnforge.core.ops;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import io.surfworks.dnnforge.core.exec.ExecutionContext;
import io.surfworks.dnnforge.core.exec.Executable;
import io.surfworks.dnnforge.core.graph.Constant;
import io.surfworks.dnnforge.core.graph.Differentiable;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.Operator;
import io.surfworks.dnnforge.core.graph.OperatorKind;
import io.surfworks.dnnforge.core.graph.ShapeException;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.graph.ValueType;
import io.surfworks.dnnforge.core.tensor.ScalarType;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * Allocates an uninitialized buffer whose shape is given by rank-0 integer inputs.
 *
 * <p>Never constant-folded: the buffer is meant to be written, possibly in
 * place, and a folded constant would be shared between executions.
 */
public record AllocEmpty(ScalarType dtype) implements Operator, Executable, Differentiable {

    public static final OperatorKind KIND = OperatorKind.of("generic", "alloc_empty");

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        List<Integer> dims = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            Value in = inputs.get(i);
            TensorType t = in.tensorType();
            if (t.rank() != 0 || !t.dtype().isInteger()) {
                throw new ShapeException("AllocEmpty: dimension " + i + " must be an integer scalar, got " + t);
            }
            if (in instanceof Constant c) {
                long dim = (long) c.scalarValue();
                if (dim < 0) {
                    throw new ShapeException("AllocEmpty: negative dimension " + dim + " at " + i);
                }
                dims.add((int) dim);
            } else {
                dims.add(TensorType.UNKNOWN);
            }
        }
        return List.of(new TensorType(dtype, dims));
    }

    @Override
    public boolean constantFoldable() {
        return false;
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        int[] shape = new int[inputs.size()];
        for (int i = 0; i < shape.length; i++) {
            shape[i] = (int) ((Tensor) inputs.get(i)).scalarValue();
        }
        return List.of(Tensor.zeros(dtype, shape));
    }

    @Override
    public List<Value> grad(Node node, List<Value> outputGrads) {
        return Arrays.asList(new Value[node.inputs().size()]);
    }

    @Override
    public boolean[][] connectionPattern(Node node) {
        return new boolean[node.inputs().size()][1];
    }
}
