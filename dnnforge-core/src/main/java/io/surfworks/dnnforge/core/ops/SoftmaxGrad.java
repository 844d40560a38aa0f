package io.surfworks.dnnforge.core.ops;

import java.util.List;

import io.surfworks.dnnforge.core.exec.ExecutionContext;
import io.surfworks.dnnforge.core.exec.Executable;
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
 * Gradient of {@link Softmax}; inputs are the output gradient and the softmax output.
 */
public record SoftmaxGrad() implements Operator, Executable {

    public static final OperatorKind KIND = OperatorKind.of("generic", "softmax_grad");

    private static final boolean[] ROWS = {false, true};

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        if (inputs.size() != 2) {
            throw new ShapeException("SoftmaxGrad takes output gradient and softmax output, got "
                    + inputs.size() + " inputs");
        }
        TensorType dy = inputs.get(0).tensorType();
        TensorType sm = inputs.get(1).tensorType();
        if (dy.rank() != 2 || sm.rank() != 2) {
            throw new ShapeException("SoftmaxGrad needs matrices, got " + dy + " and " + sm);
        }
        return List.of(sm);
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        return List.of(ReferenceKernels.softmaxBackward((Tensor) inputs.get(0), (Tensor) inputs.get(1), ROWS, false));
    }
}
