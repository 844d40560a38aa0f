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
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.graph.ValueType;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * A tensor shaped like the input, filled with a constant.
 */
public record FillLike(double value) implements Operator, Executable, Differentiable {

    public static final OperatorKind KIND = OperatorKind.of("generic", "fill_like");

    public static Value zerosLike(Value x) {
        return new FillLike(0).call(x);
    }

    public static Value onesLike(Value x) {
        return new FillLike(1).call(x);
    }

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        if (inputs.size() != 1) {
            throw new ShapeException("FillLike takes one input, got " + inputs.size());
        }
        return List.of(inputs.get(0).tensorType());
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        Tensor like = (Tensor) inputs.get(0);
        return List.of(Tensor.full(like.dtype(), value, like.shape()));
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
