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
import io.surfworks.dnnforge.core.kernel.ReferenceKernels;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * Row-wise softmax of a matrix.
 */
public record Softmax() implements Operator, Executable, Differentiable {

    public static final OperatorKind KIND = OperatorKind.of("generic", "softmax");

    private static final boolean[] ROWS = {false, true};

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        if (inputs.size() != 1) {
            throw new ShapeException("Softmax takes one input, got " + inputs.size());
        }
        TensorType t = inputs.get(0).tensorType();
        if (t.rank() != 2) {
            throw new ShapeException("Softmax needs a matrix, got " + t);
        }
        return List.of(t);
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        return List.of(ReferenceKernels.softmaxForward((Tensor) inputs.get(0), ROWS, false, true));
    }

    @Override
    public List<Value> grad(Node node, List<Value> outputGrads) {
        return List.of(new SoftmaxGrad().call(outputGrads.get(0), node.output()));
    }
}
