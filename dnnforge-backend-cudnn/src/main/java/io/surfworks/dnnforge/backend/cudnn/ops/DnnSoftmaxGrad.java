package io.surfworks.dnnforge.backend.cudnn.ops;

import java.util.List;

import io.surfworks.dnnforge.backend.cudnn.kernel.DnnKernels;
import io.surfworks.dnnforge.core.exec.Executable;
import io.surfworks.dnnforge.core.exec.ExecutionContext;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.Operator;
import io.surfworks.dnnforge.core.graph.OperatorKind;
import io.surfworks.dnnforge.core.graph.ShapeException;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.graph.ValueType;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * Gradient of {@link DnnSoftmax}: {@code (dy, sm)}, both rank 4.
 */
public record DnnSoftmaxGrad(SoftmaxAlgorithm algorithm, SoftmaxMode mode) implements Operator, Executable {

    public static final OperatorKind KIND = OperatorKind.of("dnn", "softmax_grad");

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        if (inputs.size() != 2) {
            throw new ShapeException("Softmax gradient takes (dy, sm), got " + inputs.size() + " inputs");
        }
        TensorType dy = inputs.get(0).tensorType();
        TensorType sm = inputs.get(1).tensorType();
        if (dy.rank() != 4 || sm.rank() != 4) {
            throw new ShapeException("Accelerated softmax gradient needs rank 4 tensors, got " + dy + " and " + sm);
        }
        return List.of(sm);
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        return List.of(context.service(DnnKernels.class).softmaxBackward(algorithm, mode, (Tensor) inputs.get(0),
                (Tensor) inputs.get(1)));
    }
}
