package io.surfworks.dnnforge.backend.cudnn.ops;

import java.util.List;

import io.surfworks.dnnforge.backend.cudnn.DnnFeature;
import io.surfworks.dnnforge.backend.cudnn.DnnRuntime;
import io.surfworks.dnnforge.backend.cudnn.kernel.DnnKernels;
import io.surfworks.dnnforge.core.exec.Executable;
import io.surfworks.dnnforge.core.exec.ExecutionContext;
import io.surfworks.dnnforge.core.graph.AlgorithmSelecting;
import io.surfworks.dnnforge.core.graph.Differentiable;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.Operator;
import io.surfworks.dnnforge.core.graph.OperatorKind;
import io.surfworks.dnnforge.core.graph.ShapeException;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.graph.ValueType;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * Accelerated softmax of a rank-4 tensor, normalized over channels or over
 * each spatial instance.
 *
 * <p>The canonical constructor does not consult the backend. Graph builders,
 * rewrites and {@link io.surfworks.dnnforge.backend.cudnn.config.OperatorStates}
 * go through {@link #create}, which refuses {@link SoftmaxAlgorithm#LOG} on a
 * backend that predates it.
 */
public record DnnSoftmax(SoftmaxAlgorithm algorithm, SoftmaxMode mode)
        implements Operator, Executable, Differentiable, AlgorithmSelecting<SoftmaxAlgorithm> {

    public static final OperatorKind KIND = OperatorKind.of("dnn", "softmax");

    /**
     * The checked way to build a softmax for {@code runtime}.
     *
     * @throws io.surfworks.dnnforge.backend.cudnn.FeatureUnsupportedException for log softmax on an old backend
     */
    public static DnnSoftmax create(DnnRuntime runtime, SoftmaxAlgorithm algorithm, SoftmaxMode mode) {
        if (algorithm == SoftmaxAlgorithm.LOG) {
            runtime.require(DnnFeature.LOG_SOFTMAX);
        }
        return new DnnSoftmax(algorithm, mode);
    }

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        if (inputs.size() != 1) {
            throw new ShapeException("Softmax takes one input, got " + inputs.size());
        }
        TensorType x = inputs.get(0).tensorType();
        if (x.rank() != 4) {
            throw new ShapeException("Accelerated softmax needs a rank 4 tensor, got " + x);
        }
        return List.of(x);
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        return List.of(context.service(DnnKernels.class).softmaxForward(algorithm, mode, (Tensor) inputs.get(0)));
    }

    @Override
    public List<Value> grad(Node node, List<Value> outputGrads) {
        return List.of(new DnnSoftmaxGrad(algorithm, mode).call(outputGrads.get(0), node.output()));
    }
}
