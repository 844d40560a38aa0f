package io.surfworks.dnnforge.backend.cudnn.kernel;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import io.surfworks.dnnforge.backend.cudnn.ops.BackwardAlgorithm;
import io.surfworks.dnnforge.backend.cudnn.ops.ForwardAlgorithm;
import io.surfworks.dnnforge.backend.cudnn.ops.SoftmaxAlgorithm;
import io.surfworks.dnnforge.backend.cudnn.ops.SoftmaxMode;
import io.surfworks.dnnforge.core.graph.ShapeException;
import io.surfworks.dnnforge.core.kernel.ReferenceKernels;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * CPU implementation of {@link DnnKernels} on top of {@link ReferenceKernels}.
 *
 * <p>Every algorithm computes the same result. Descriptors live in a table
 * keyed by a synthetic address; destroying one twice, or using one after it
 * was destroyed, is an error.
 */
public final class ReferenceDnnKernels implements DnnKernels {

    private final AtomicLong nextAddress = new AtomicLong(0x1000);
    private final Map<Long, ConvolutionGeometry> convolutions = new ConcurrentHashMap<>();
    private final Map<Long, PoolingGeometry> poolings = new ConcurrentHashMap<>();
    private final AtomicInteger created = new AtomicInteger();
    private final AtomicInteger destroyed = new AtomicInteger();
    private final AtomicInteger algorithmChoices = new AtomicInteger();

    // ==================== Descriptors ====================

    @Override
    public long createConvolutionDescriptor(ConvolutionGeometry geometry) {
        long address = nextAddress.getAndAdd(0x10);
        convolutions.put(address, geometry);
        created.incrementAndGet();
        return address;
    }

    @Override
    public void destroyConvolutionDescriptor(long descriptor) {
        if (convolutions.remove(descriptor) == null) {
            throw new IllegalStateException("Convolution descriptor 0x" + Long.toHexString(descriptor)
                    + " destroyed twice or never created");
        }
        destroyed.incrementAndGet();
    }

    @Override
    public long createPoolingDescriptor(PoolingGeometry geometry) {
        long address = nextAddress.getAndAdd(0x10);
        poolings.put(address, geometry);
        created.incrementAndGet();
        return address;
    }

    @Override
    public void destroyPoolingDescriptor(long descriptor) {
        if (poolings.remove(descriptor) == null) {
            throw new IllegalStateException("Pooling descriptor 0x" + Long.toHexString(descriptor)
                    + " destroyed twice or never created");
        }
        destroyed.incrementAndGet();
    }

    public int liveDescriptors() {
        return convolutions.size() + poolings.size();
    }

    public int createdDescriptors() {
        return created.get();
    }

    public int destroyedDescriptors() {
        return destroyed.get();
    }

    public int algorithmChoices() {
        return algorithmChoices.get();
    }

    public ConvolutionGeometry convolutionGeometry(long descriptor) {
        ConvolutionGeometry geometry = convolutions.get(descriptor);
        if (geometry == null) {
            throw new IllegalStateException("Unknown convolution descriptor 0x" + Long.toHexString(descriptor));
        }
        return geometry;
    }

    public PoolingGeometry poolingGeometry(long descriptor) {
        PoolingGeometry geometry = poolings.get(descriptor);
        if (geometry == null) {
            throw new IllegalStateException("Unknown pooling descriptor 0x" + Long.toHexString(descriptor));
        }
        return geometry;
    }

    // ==================== Convolution ====================

    @Override
    public void convolutionForward(long descriptor, ForwardAlgorithm algorithm, Tensor img, Tensor kerns, Tensor out,
                                   double alpha, double beta) {
        ConvolutionGeometry g = convolutionGeometry(descriptor);
        ReferenceKernels.convolutionForward(img, kerns, out, g.padArray(), g.strideArray(),
                g.mode().flipsFilters(), alpha, beta);
    }

    @Override
    public void convolutionBackwardFilter(long descriptor, BackwardAlgorithm algorithm, Tensor img, Tensor top,
                                          Tensor out, double alpha, double beta) {
        ConvolutionGeometry g = convolutionGeometry(descriptor);
        ReferenceKernels.convolutionBackwardFilter(img, top, out, g.padArray(), g.strideArray(),
                g.mode().flipsFilters(), alpha, beta);
    }

    @Override
    public void convolutionBackwardData(long descriptor, BackwardAlgorithm algorithm, Tensor kerns, Tensor top,
                                        Tensor out, double alpha, double beta) {
        ConvolutionGeometry g = convolutionGeometry(descriptor);
        ReferenceKernels.convolutionBackwardData(kerns, top, out, g.padArray(), g.strideArray(),
                g.mode().flipsFilters(), alpha, beta);
    }

    @Override
    public ForwardAlgorithm chooseForwardAlgorithm(long descriptor, int[] imgShape, int[] kernsShape, boolean timed) {
        algorithmChoices.incrementAndGet();
        ConvolutionGeometry g = convolutionGeometry(descriptor);
        return g.spatialRank() == 2 && timed ? ForwardAlgorithm.LARGE : ForwardAlgorithm.SMALL;
    }

    @Override
    public BackwardAlgorithm chooseBackwardAlgorithm(long descriptor, int[] inputShape, int[] topShape,
                                                     boolean timed) {
        algorithmChoices.incrementAndGet();
        convolutionGeometry(descriptor);
        return BackwardAlgorithm.NONE;
    }

    // ==================== Pooling ====================

    @Override
    public Tensor poolingForward(long descriptor, Tensor img) {
        PoolingGeometry g = poolingGeometry(descriptor);
        int nd = g.spatialRank();
        int[] shape = img.shape();
        if (shape.length != nd + 2) {
            throw new ShapeException("Pooling over " + nd + " spatial axes needs a rank " + (nd + 2)
                    + " image, got " + Arrays.toString(shape));
        }
        int[] window = toArray(g.window());
        int[] stride = toArray(g.stride());
        int[] pad = toArray(g.pad());
        int[] outShape = shape.clone();
        for (int d = 0; d < nd; d++) {
            outShape[d + 2] = ReferenceKernels.outputSize(shape[d + 2], window[d], pad[d], stride[d]);
        }
        return ReferenceKernels.poolingForward(img, outShape, window, stride, pad, g.mode());
    }

    @Override
    public Tensor poolingBackward(long descriptor, Tensor img, Tensor out, Tensor outGrad) {
        PoolingGeometry g = poolingGeometry(descriptor);
        if (!Arrays.equals(out.shape(), outGrad.shape())) {
            throw new ShapeException("Pooling gradient: forward output " + Arrays.toString(out.shape())
                    + " and its gradient " + Arrays.toString(outGrad.shape()) + " differ in shape");
        }
        return ReferenceKernels.poolingBackward(img, outGrad, toArray(g.window()), toArray(g.stride()),
                toArray(g.pad()), g.mode());
    }

    // ==================== Softmax ====================

    @Override
    public Tensor softmaxForward(SoftmaxAlgorithm algorithm, SoftmaxMode mode, Tensor x) {
        boolean[] axes = ReferenceKernels.softmaxAxes(x.rank(), mode == SoftmaxMode.INSTANCE);
        return ReferenceKernels.softmaxForward(x, axes, algorithm == SoftmaxAlgorithm.LOG,
                algorithm != SoftmaxAlgorithm.FAST);
    }

    @Override
    public Tensor softmaxBackward(SoftmaxAlgorithm algorithm, SoftmaxMode mode, Tensor outGrad, Tensor sm) {
        boolean[] axes = ReferenceKernels.softmaxAxes(sm.rank(), mode == SoftmaxMode.INSTANCE);
        return ReferenceKernels.softmaxBackward(outGrad, sm, axes, algorithm == SoftmaxAlgorithm.LOG);
    }

    private static int[] toArray(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).toArray();
    }
}
