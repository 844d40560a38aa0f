package io.surfworks.dnnforge.backend.cudnn.ops;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import io.surfworks.dnnforge.backend.cudnn.DnnFeature;
import io.surfworks.dnnforge.backend.cudnn.kernel.DnnKernels;
import io.surfworks.dnnforge.core.exec.ExecutionContext;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.OperatorKind;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.grad.Gradients;
import io.surfworks.dnnforge.core.ops.Contiguous;
import io.surfworks.dnnforge.core.ops.Elemwise;
import io.surfworks.dnnforge.core.ops.Shapes;
import io.surfworks.dnnforge.core.resource.NativeHandle;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * Image gradient of a forward convolution: {@code (kerns, top, out, desc, alpha, beta)},
 * where {@code out} is shaped like the image.
 */
public record DnnConvolutionGradInputs(BackwardAlgorithm algorithm, boolean inplace)
        implements DnnConvolutionOp<BackwardAlgorithm> {

    public static final OperatorKind KIND = OperatorKind.of("dnn", "conv_grad_i");

    public DnnConvolutionGradInputs(BackwardAlgorithm algorithm) {
        this(algorithm, false);
    }

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    @Override
    public DnnConvolutionGradInputs withInplace(boolean inplace) {
        return new DnnConvolutionGradInputs(algorithm, inplace);
    }

    @Override
    public boolean supportsSpatialRank(int spatialRank) {
        return algorithm.supportsSpatialRank(spatialRank);
    }

    @Override
    public Optional<DnnFeature> requiredFeature() {
        return algorithm.requiredFeature();
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        Tensor kerns = (Tensor) inputs.get(0);
        Tensor top = (Tensor) inputs.get(1);
        NativeHandle desc = (NativeHandle) inputs.get(DESCRIPTOR);
        DnnKernels kernels = context.service(DnnKernels.class);
        Tensor out = DnnConvolutionOp.target((Tensor) inputs.get(OUTPUT), inplace);
        BackwardAlgorithm chosen = algorithm;
        if (algorithm.isAutomatic()) {
            chosen = context.service(AlgorithmCache.class).resolve(node, algorithm.choosesOnShapeChange(),
                    DnnConvolutionOp.shapeKey(out, top),
                    () -> kernels.chooseBackwardAlgorithm(desc.address(), out.shape(), top.shape(),
                            algorithm.isTimed()));
        }
        kernels.convolutionBackwardData(desc.address(), chosen, kerns, top, out,
                DnnConvolutionOp.scalar(inputs.get(ALPHA)), DnnConvolutionOp.scalar(inputs.get(BETA)));
        return List.of(out);
    }

    @Override
    public List<Value> grad(Node node, List<Value> outputGrads) {
        Value kerns = node.input(0);
        Value top = node.input(1);
        Value desc = node.input(DESCRIPTOR);
        Value alpha = node.input(ALPHA);
        Value beta = node.input(BETA);
        Value img = Contiguous.of(outputGrads.get(0));

        Value dKerns = new DnnConvolutionGradWeights(BackwardAlgorithm.DEFAULT).call(
                img, top, Shapes.emptyLike(kerns), desc, DnnConvolutionOp.one(img), DnnConvolutionOp.zero(img));
        Value dTop = new DnnConvolution(ForwardAlgorithm.DEFAULT).call(
                img, kerns, Shapes.emptyLike(top), desc, DnnConvolutionOp.one(img), DnnConvolutionOp.zero(img));
        return Arrays.asList(
                Elemwise.mul(dKerns, alpha),
                Elemwise.mul(dTop, alpha),
                Elemwise.mul(img, beta),
                null,
                Gradients.notImplemented(node, ALPHA, "gradient of the alpha scale"),
                Gradients.notImplemented(node, BETA, "gradient of the beta scale"));
    }
}
