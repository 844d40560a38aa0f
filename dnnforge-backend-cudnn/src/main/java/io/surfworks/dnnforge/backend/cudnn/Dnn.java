package io.surfworks.dnnforge.backend.cudnn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.surfworks.dnnforge.backend.cudnn.descriptor.ConvolutionDescriptorBuilder;
import io.surfworks.dnnforge.backend.cudnn.descriptor.PoolingDescriptorBuilder;
import io.surfworks.dnnforge.backend.cudnn.ops.BackwardAlgorithm;
import io.surfworks.dnnforge.backend.cudnn.ops.ConvMode;
import io.surfworks.dnnforge.backend.cudnn.ops.DnnConvolution;
import io.surfworks.dnnforge.backend.cudnn.ops.DnnConvolutionGradInputs;
import io.surfworks.dnnforge.backend.cudnn.ops.DnnConvolutionGradWeights;
import io.surfworks.dnnforge.backend.cudnn.ops.DnnConvolutionOp;
import io.surfworks.dnnforge.backend.cudnn.ops.DnnPooling;
import io.surfworks.dnnforge.backend.cudnn.ops.ForwardAlgorithm;
import io.surfworks.dnnforge.core.graph.ConfigurationException;
import io.surfworks.dnnforge.core.graph.Constant;
import io.surfworks.dnnforge.core.graph.ShapeException;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.ops.BorderMode;
import io.surfworks.dnnforge.core.ops.Cast;
import io.surfworks.dnnforge.core.ops.Contiguous;
import io.surfworks.dnnforge.core.ops.Conv;
import io.surfworks.dnnforge.core.ops.DimShuffle;
import io.surfworks.dnnforge.core.ops.DirectionHint;
import io.surfworks.dnnforge.core.ops.Flip;
import io.surfworks.dnnforge.core.ops.PoolMode;
import io.surfworks.dnnforge.core.ops.Shapes;
import io.surfworks.dnnforge.core.tensor.ScalarType;

/**
 * Entry points that assemble accelerated operator subgraphs from high-level arguments.
 *
 * <p>Example:
 * <pre>{@code
 * Value y = Dnn.convolution(runtime, img, kerns, BorderMode.FULL, List.of(1, 1),
 *         ConvMode.CONVOLUTION, DirectionHint.NONE, null);
 * Value pooled = Dnn.pooling(runtime, y, List.of(2, 2), List.of(2, 2), PoolMode.MAX, List.of(0, 0));
 * }</pre>
 */
public final class Dnn {

    private Dnn() {
    }

    // ==================== Convolution ====================

    /**
     * Valid, unit-stride true convolution with the configured default algorithm.
     */
    public static Value convolution(DnnRuntime runtime, Value img, Value kerns) {
        int nd = img.tensorType().rank() - 2;
        return convolution(runtime, img, kerns, BorderMode.VALID, Collections.nCopies(Math.max(nd, 2), 1),
                ConvMode.CONVOLUTION, DirectionHint.NONE, null);
    }

    /**
     * Builds an accelerated convolution of {@code img} with {@code kerns}.
     *
     * <p>Depending on the border, stride and hint the result is computed by a
     * forward convolution or by the adjoint of a gradient convolution; see
     * {@link #chooseLowering}. All three graphs compute the same values.
     *
     * @param algorithm forward algorithm, or null for the configured default
     * @throws BackendUnavailableException if the backend is unavailable
     * @throws FeatureUnsupportedException if the algorithm or the spatial rank needs a newer backend
     * @throws ShapeException if the operands do not fit together
     * @throws ConfigurationException if border or subsample are malformed
     */
    public static Value convolution(DnnRuntime runtime, Value img, Value kerns, BorderMode border,
                                    List<Integer> subsample, ConvMode mode, DirectionHint hint,
                                    ForwardAlgorithm algorithm) {
        runtime.requireAvailable();
        int spatialRank = img.tensorType().rank() - 2;
        if ((spatialRank == 2 || spatialRank == 3) && subsample.size() != spatialRank) {
            throw new ConfigurationException("Subsample " + subsample + " does not match the "
                    + spatialRank + " spatial axes of the image");
        }
        // validates ranks, channels and geometry before any node is built
        new Conv(border, subsample, hint).outputTypes(List.of(img, kerns));
        if (subsample.size() == 3) {
            runtime.require(DnnFeature.ND_DESCRIPTORS);
        }
        return switch (chooseLowering(border, subsample, hint)) {
            case WEIGHT_GRADIENT_ADJOINT -> weightGradientAdjoint(runtime, img, kerns, mode);
            case INPUT_GRADIENT_ADJOINT -> inputGradientAdjoint(runtime, img, kerns, mode);
            case FORWARD -> forward(runtime, img, kerns, border, subsample, mode,
                    algorithm != null ? algorithm : runtime.config().defaultForwardAlgorithm());
        };
    }

    /**
     * Picks the operator graph for a convolution.
     */
    public static ConvolutionLowering chooseLowering(BorderMode border, List<Integer> subsample, DirectionHint hint) {
        boolean unitStride = subsample.stream().allMatch(s -> s == 1);
        if (border.isValid() && unitStride && hint == DirectionHint.BPROP_WEIGHTS) {
            return ConvolutionLowering.WEIGHT_GRADIENT_ADJOINT;
        }
        if (border.isFull() && unitStride && hint != DirectionHint.FORCE_FORWARD) {
            return ConvolutionLowering.INPUT_GRADIENT_ADJOINT;
        }
        return ConvolutionLowering.FORWARD;
    }

    /**
     * Whether the backend can run {@code lowering} with {@code spatialRank}
     * spatial axes using the configured default algorithms.
     */
    public static boolean canLower(DnnRuntime runtime, int spatialRank, ConvolutionLowering lowering) {
        if (!runtime.isAvailable()) {
            return false;
        }
        if (spatialRank == 3 && !runtime.supports(DnnFeature.ND_DESCRIPTORS)) {
            return false;
        }
        if (lowering == ConvolutionLowering.FORWARD) {
            ForwardAlgorithm algorithm = runtime.config().defaultForwardAlgorithm();
            return algorithm.supportsSpatialRank(spatialRank)
                    && algorithm.requiredFeature().map(runtime::supports).orElse(true);
        }
        BackwardAlgorithm algorithm = runtime.config().defaultBackwardAlgorithm();
        return algorithm.supportsSpatialRank(spatialRank)
                && algorithm.requiredFeature().map(runtime::supports).orElse(true);
    }

    private static Value weightGradientAdjoint(DnnRuntime runtime, Value img, Value kerns, ConvMode mode) {
        int nd = img.tensorType().rank() - 2;
        DimShuffle swap = swapBatchAndChannel(nd);
        Value swappedImg = Contiguous.of(swap.call(img));
        Value k = kerns;
        if (mode.flipsFilters()) {
            k = new Flip(spatialAxes(nd)).call(k);
        }
        Value swappedKerns = Contiguous.of(swap.call(k));

        List<Value> outDims = new ArrayList<>(nd + 2);
        outDims.add(Shapes.dim(swappedKerns, 1));
        outDims.add(Shapes.dim(swappedImg, 1));
        for (int d = 2; d < nd + 2; d++) {
            outDims.add(Shapes.add(Shapes.sub(Shapes.dim(swappedImg, d), Shapes.dim(swappedKerns, d)),
                    Shapes.constant(1)));
        }
        Value out = Shapes.alloc(img.tensorType().dtype(), outDims);
        Value desc = ConvolutionDescriptorBuilder.create(runtime, BorderMode.VALID, Collections.nCopies(nd, 1),
                ConvMode.CROSS_CORRELATION).call(Shapes.shapeOf(out));
        DnnConvolutionOp<BackwardAlgorithm> op =
                new DnnConvolutionGradWeights(runtime.config().defaultBackwardAlgorithm());
        op.checkSupported(runtime);
        Value conv = op.call(swappedImg, swappedKerns, out, desc, one(img), zero(img));
        return swap.call(conv);
    }

    private static Value inputGradientAdjoint(DnnRuntime runtime, Value img, Value kerns, ConvMode mode) {
        int nd = img.tensorType().rank() - 2;
        Value contiguousImg = Contiguous.of(img);
        Value swappedKerns = Contiguous.of(swapBatchAndChannel(nd).call(kerns));

        List<Value> outDims = new ArrayList<>(nd + 2);
        outDims.add(Shapes.dim(contiguousImg, 0));
        outDims.add(Shapes.dim(swappedKerns, 1));
        for (int d = 2; d < nd + 2; d++) {
            outDims.add(Shapes.sub(Shapes.add(Shapes.dim(contiguousImg, d), Shapes.dim(swappedKerns, d)),
                    Shapes.constant(1)));
        }
        Value out = Shapes.alloc(img.tensorType().dtype(), outDims);
        Value desc = ConvolutionDescriptorBuilder.create(runtime, BorderMode.VALID, Collections.nCopies(nd, 1),
                mode.complement()).call(Shapes.shapeOf(swappedKerns));
        DnnConvolutionOp<BackwardAlgorithm> op =
                new DnnConvolutionGradInputs(runtime.config().defaultBackwardAlgorithm());
        op.checkSupported(runtime);
        return op.call(swappedKerns, contiguousImg, out, desc, one(img), zero(img));
    }

    private static Value forward(DnnRuntime runtime, Value img, Value kerns, BorderMode border,
                                 List<Integer> subsample, ConvMode mode, ForwardAlgorithm algorithm) {
        int nd = subsample.size();
        Value contiguousImg = Contiguous.of(img);
        Value contiguousKerns = Contiguous.of(kerns);
        ConvolutionDescriptorBuilder descOp = ConvolutionDescriptorBuilder.create(runtime, border, subsample, mode);
        Value desc = descOp.call(Shapes.shapeOf(contiguousKerns));

        List<Value> outDims = new ArrayList<>(nd + 2);
        outDims.add(Shapes.dim(contiguousImg, 0));
        outDims.add(Shapes.dim(contiguousKerns, 0));
        BorderMode resolved = descOp.border();
        for (int d = 0; d < nd; d++) {
            Value in = Shapes.dim(contiguousImg, d + 2);
            Value k = Shapes.dim(contiguousKerns, d + 2);
            Value padded = switch (resolved.kind()) {
                case VALID -> in;
                // in + 2(k - 1)
                case FULL -> Shapes.add(in, Shapes.mul(Shapes.constant(2), Shapes.sub(k, Shapes.constant(1))));
                case UNIFORM, EXPLICIT -> Shapes.add(in, Shapes.constant(2L * resolved.pads().get(d)));
            };
            outDims.add(Shapes.add(
                    Shapes.floorDiv(Shapes.sub(padded, k), Shapes.constant(subsample.get(d))),
                    Shapes.constant(1)));
        }
        Value out = Shapes.alloc(img.tensorType().dtype(), outDims);
        DnnConvolution op = new DnnConvolution(algorithm);
        op.checkSupported(runtime);
        return op.call(contiguousImg, contiguousKerns, out, desc, one(img), zero(img));
    }

    private static DimShuffle swapBatchAndChannel(int nd) {
        List<Integer> pattern = new ArrayList<>(nd + 2);
        pattern.add(1);
        pattern.add(0);
        for (int d = 2; d < nd + 2; d++) {
            pattern.add(d);
        }
        return new DimShuffle(pattern);
    }

    private static List<Integer> spatialAxes(int nd) {
        List<Integer> axes = new ArrayList<>(nd);
        for (int d = 2; d < nd + 2; d++) {
            axes.add(d);
        }
        return axes;
    }

    // ==================== Pooling ====================

    /**
     * Builds accelerated pooling of {@code img}.
     *
     * @param pad zero padding per spatial axis; null means none
     * @throws BackendUnavailableException if the backend is unavailable
     * @throws FeatureUnsupportedException for 3-D pooling on an old backend
     */
    public static Value pooling(DnnRuntime runtime, Value img, List<Integer> window, List<Integer> stride,
                                PoolMode mode, List<Integer> pad) {
        runtime.requireAvailable();
        List<Integer> padding = pad != null ? pad : Collections.nCopies(window.size(), 0);
        PoolingDescriptorBuilder descOp = PoolingDescriptorBuilder.create(runtime, window, stride, padding, mode);
        return new DnnPooling().call(Contiguous.of(img), descOp.call());
    }

    // ==================== Scalars ====================

    /**
     * Converts an α or β argument into a rank-0 value of {@code dtype}. Accepts
     * a {@link Number} or a rank-0 {@link Value}; null stands for {@code defaultValue}.
     *
     * @throws ShapeException if a value argument is not rank 0
     */
    public static Value scalarInput(Object scale, ScalarType dtype, double defaultValue) {
        if (scale == null) {
            return Constant.scalar(dtype, defaultValue);
        }
        if (scale instanceof Number number) {
            return Constant.scalar(dtype, number.doubleValue());
        }
        if (scale instanceof Value value) {
            TensorType type = value.tensorType();
            if (type.rank() != 0) {
                throw new ShapeException("Scale argument must be rank 0, got " + type);
            }
            return Cast.to(value, dtype);
        }
        throw new IllegalArgumentException("Scale argument must be a Number or a Value, got "
                + scale.getClass().getName());
    }

    private static Value one(Value like) {
        return scalarInput(null, like.tensorType().dtype(), 1);
    }

    private static Value zero(Value like) {
        return scalarInput(null, like.tensorType().dtype(), 0);
    }
}
