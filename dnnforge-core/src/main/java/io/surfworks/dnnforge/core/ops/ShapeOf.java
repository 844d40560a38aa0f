package io.surfworks.dnnforge.core.ops;

import java.util.Arrays;
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
import io.surfworks.dnnforge.core.tensor.ScalarType;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * A tensor's runtime shape as a rank-1 int64 tensor.
 */
public record ShapeOf() implements Operator, Executable, Differentiable {

    public static final OperatorKind KIND = OperatorKind.of("generic", "shape");

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        if (inputs.size() != 1) {
            throw new ShapeException("ShapeOf takes one input, got " + inputs.size());
        }
        return List.of(TensorType.of(ScalarType.I64, inputs.get(0).tensorType().rank()));
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        int[] shape = ((Tensor) inputs.get(0)).shape();
        long[] dims = new long[shape.length];
        for (int i = 0; i < shape.length; i++) {
            dims[i] = shape[i];
        }
        return List.of(Tensor.vector(dims));
    }

    @Override
    public List<Value> grad(Node node, List<Value> outputGrads) {
        return Arrays.asList((Value) null);
    }

    @Override
    public boolean[][] connectionPattern(Node node) {
        return new boolean[][] {{false}};
    }
}
