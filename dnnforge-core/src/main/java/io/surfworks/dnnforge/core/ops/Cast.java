package io.surfworks.dnnforge.core.ops;

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
import io.surfworks.dnnforge.core.tensor.ScalarType;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * Element type conversion.
 */
public record Cast(ScalarType target) implements Operator, Executable, Differentiable {

    public static final OperatorKind KIND = OperatorKind.of("generic", "cast");

    /**
     * Returns {@code x} converted to {@code target}, or {@code x} itself if it already has that type.
     */
    public static Value to(Value x, ScalarType target) {
        if (x.tensorType().dtype() == target) {
            return x;
        }
        return new Cast(target).call(x);
    }

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        if (inputs.size() != 1) {
            throw new ShapeException("Cast takes one input, got " + inputs.size());
        }
        return List.of(inputs.get(0).tensorType().withDtype(target));
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        return List.of(((Tensor) inputs.get(0)).cast(target));
    }

    @Override
    public List<Value> grad(Node node, List<Value> outputGrads) {
        return List.of(to(outputGrads.get(0), node.input(0).tensorType().dtype()));
    }
}
