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
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * Guarantees a row-major contiguous layout, copying only when needed.
 */
public record Contiguous() implements Operator, Executable, Differentiable {

    public static final OperatorKind KIND = OperatorKind.of("generic", "contiguous");

    /**
     * Wraps {@code x} unless it is already the output of a contiguity guard.
     */
    public static Value of(Value x) {
        if (x.isProducedBy(KIND)) {
            return x;
        }
        return new Contiguous().call(x);
    }

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        if (inputs.size() != 1) {
            throw new ShapeException("Contiguous takes one input, got " + inputs.size());
        }
        return List.of(inputs.get(0).tensorType());
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        return List.of(((Tensor) inputs.get(0)).contiguous());
    }

    @Override
    public List<Value> grad(Node node, List<Value> outputGrads) {
        return List.of(outputGrads.get(0));
    }
}
