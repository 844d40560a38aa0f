package io.surfworks.dnnforge.backend.cudnn.kernel;

import io.surfworks.dnnforge.backend.cudnn.ops.BackwardAlgorithm;
import io.surfworks.dnnforge.backend.cudnn.ops.ForwardAlgorithm;
import io.surfworks.dnnforge.backend.cudnn.ops.SoftmaxAlgorithm;
import io.surfworks.dnnforge.backend.cudnn.ops.SoftmaxMode;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * The accelerated kernel library. Descriptors are opaque native addresses
 * created and destroyed through this interface.
 *
 * <p>Convolution entry points compute {@code out = alpha * op(a, b) + beta * out}
 * in place on {@code out}.
 */
public interface DnnKernels {

    // ==================== Descriptors ====================

    long createConvolutionDescriptor(ConvolutionGeometry geometry);

    void destroyConvolutionDescriptor(long descriptor);

    long createPoolingDescriptor(PoolingGeometry geometry);

    void destroyPoolingDescriptor(long descriptor);

    // ==================== Convolution ====================

    void convolutionForward(long descriptor, ForwardAlgorithm algorithm, Tensor img, Tensor kerns, Tensor out,
                            double alpha, double beta);

    /**
     * Gradient with respect to the filters of the forward convolution described by {@code descriptor}.
     */
    void convolutionBackwardFilter(long descriptor, BackwardAlgorithm algorithm, Tensor img, Tensor top, Tensor out,
                                   double alpha, double beta);

    /**
     * Gradient with respect to the image of the forward convolution described by {@code descriptor}.
     */
    void convolutionBackwardData(long descriptor, BackwardAlgorithm algorithm, Tensor kerns, Tensor top, Tensor out,
                                 double alpha, double beta);

    /**
     * Picks a concrete forward algorithm for the given shapes.
     *
     * @param timed benchmark the candidates rather than use the heuristic
     */
    ForwardAlgorithm chooseForwardAlgorithm(long descriptor, int[] imgShape, int[] kernsShape, boolean timed);

    BackwardAlgorithm chooseBackwardAlgorithm(long descriptor, int[] inputShape, int[] topShape, boolean timed);

    // ==================== Pooling ====================

    Tensor poolingForward(long descriptor, Tensor img);

    /**
     * Gradient of pooling. Average modes ignore the values of {@code out} but still check its shape.
     */
    Tensor poolingBackward(long descriptor, Tensor img, Tensor out, Tensor outGrad);

    // ==================== Softmax ====================

    Tensor softmaxForward(SoftmaxAlgorithm algorithm, SoftmaxMode mode, Tensor x);

    Tensor softmaxBackward(SoftmaxAlgorithm algorithm, SoftmaxMode mode, Tensor outGrad, Tensor sm);
}
