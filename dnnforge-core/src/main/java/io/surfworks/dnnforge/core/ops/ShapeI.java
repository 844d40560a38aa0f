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
 * Extracts one dimension of a tensor's runtime shape as an int64 scalar.
 */
public record ShapeI(int axis) implements Operator, Executable, Differentiable {

    public static final OperatorKind KIND = OperatorKind.of("generic", "shape_i");

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        if (inputs.size() != 1) {
            throw new ShapeException("ShapeI takes one input, got " + inputs.size());
        }
        TensorType t = inputs.get(0).tensorType();
        if (axis < 0 || axis >= t.rank()) {
            throw new ShapeException("ShapeI: axis " + axis + " out of range for " + t);
        }
        return List.of(TensorType.scalar(ScalarType.I64));
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        return List.of(Tensor.scalar(ScalarType.I64, ((Tensor) inputs.get(0)).dim(axis)));
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
