package io.surfworks.dnnforge.backend.cudnn.descriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import io.surfworks.dnnforge.backend.cudnn.DnnFeature;
import io.surfworks.dnnforge.backend.cudnn.DnnRuntime;
import io.surfworks.dnnforge.backend.cudnn.kernel.ConvolutionGeometry;
import io.surfworks.dnnforge.backend.cudnn.kernel.DnnKernels;
import io.surfworks.dnnforge.backend.cudnn.ops.ConvMode;
import io.surfworks.dnnforge.core.exec.Executable;
import io.surfworks.dnnforge.core.exec.ExecutionContext;
import io.surfworks.dnnforge.core.graph.ConfigurationException;
import io.surfworks.dnnforge.core.graph.HandleType;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.Operator;
import io.surfworks.dnnforge.core.graph.OperatorKind;
import io.surfworks.dnnforge.core.graph.ShapeException;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.graph.ValueType;
import io.surfworks.dnnforge.core.ops.BorderMode;
import io.surfworks.dnnforge.core.resource.NativeHandle;
import io.surfworks.dnnforge.core.resource.ResourceKey;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * Builds a native convolution descriptor from a kernel-shape input.
 *
 * <p>The only input is the 1-D integer shape of the filters,
 * {@code [out_channel, channel, kernel...]}, which "full" padding needs to
 * resolve. The descriptor is materialized per execution context and is never
 * constant-folded, even when the kernel shape is constant.
 *
 * <p>Example:
 * <pre>{@code
 * Value desc = ConvolutionDescriptorBuilder.create(runtime, BorderMode.VALID, List.of(1, 1), ConvMode.CONVOLUTION)
 *         .call(Shapes.shapeOf(kerns));
 * }</pre>
 *
 * @param border padding policy; a uniform pad is expanded to the stride's rank
 * @param subsample stride per spatial axis
 * @param mode convolution or cross-correlation
 */
public record ConvolutionDescriptorBuilder(BorderMode border, List<Integer> subsample, ConvMode mode)
        implements Operator, Executable {

    private static final Logger LOG = Logger.getLogger(ConvolutionDescriptorBuilder.class.getName());

    public static final OperatorKind KIND = OperatorKind.of("dnn", "conv_desc");

    public static final HandleType HANDLE_TYPE =
            new HandleType("cudnnConvolutionDescriptor_t", "cudnnDestroyConvolutionDescriptor");

    public ConvolutionDescriptorBuilder {
        subsample = List.copyOf(subsample);
        if (subsample.size() != 2 && subsample.size() != 3) {
            throw new ConfigurationException("Convolution descriptor subsample must have 2 or 3 entries, got "
                    + subsample);
        }
        for (int s : subsample) {
            if (s < 1) {
                throw new ConfigurationException("Convolution descriptor subsample entries must be positive, got "
                        + subsample);
            }
        }
        if (border.kind() == BorderMode.Kind.EXPLICIT && border.pads().size() != subsample.size()) {
            throw new ConfigurationException("Convolution descriptor padding " + border
                    + " must have as many entries as subsample " + subsample);
        }
        border = border.expandTo(subsample.size());
    }

    /**
     * Builds the operator after checking that the backend supports its spatial rank.
     *
     * @throws io.surfworks.dnnforge.backend.cudnn.FeatureUnsupportedException for 3-D on an old backend
     */
    public static ConvolutionDescriptorBuilder create(DnnRuntime runtime, BorderMode border, List<Integer> subsample,
                                                      ConvMode mode) {
        ConvolutionDescriptorBuilder builder = new ConvolutionDescriptorBuilder(border, subsample, mode);
        if (builder.spatialRank() == 3) {
            runtime.require(DnnFeature.ND_DESCRIPTORS);
        }
        return builder;
    }

    public int spatialRank() {
        return subsample.size();
    }

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    @Override
    public boolean constantFoldable() {
        return false;
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        if (inputs.size() != 1) {
            throw new ShapeException("Convolution descriptor takes the kernel shape, got " + inputs.size()
                    + " inputs");
        }
        TensorType shape = inputs.get(0).tensorType();
        if (shape.rank() != 1 || !shape.dtype().isInteger()) {
            throw new ShapeException("Convolution descriptor kernel shape must be a 1-D integer tensor, got "
                    + shape);
        }
        if (shape.isKnown(0) && shape.dim(0) != spatialRank() + 2) {
            throw new ShapeException("Convolution descriptor with " + spatialRank()
                    + " spatial axes needs a kernel shape of length " + (spatialRank() + 2) + ", got " + shape);
        }
        return List.of(HANDLE_TYPE);
    }

    /**
     * Resolves the pads for a concrete kernel shape.
     */
    public ConvolutionGeometry geometry(long[] kernelShape) {
        if (kernelShape.length != spatialRank() + 2) {
            throw new ShapeException("Kernel shape has " + kernelShape.length + " entries, expected "
                    + (spatialRank() + 2));
        }
        int[] kernelSpatial = new int[spatialRank()];
        for (int d = 0; d < kernelSpatial.length; d++) {
            kernelSpatial[d] = Math.toIntExact(kernelShape[d + 2]);
        }
        List<Integer> pads = new ArrayList<>(spatialRank());
        for (int pad : border.resolve(kernelSpatial)) {
            pads.add(pad);
        }
        return new ConvolutionGeometry(pads, subsample, mode);
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        long[] kernelShape = ((Tensor) inputs.get(0)).toLongArray();
        DnnRuntime runtime = context.service(DnnRuntime.class);
        DnnKernels kernels = context.service(DnnKernels.class);
        List<Long> shapeKey = new ArrayList<>(kernelShape.length);
        for (long d : kernelShape) {
            shapeKey.add(d);
        }
        NativeHandle handle = context.resource(new ResourceKey(this, shapeKey, runtime.version()), () -> {
            ConvolutionGeometry geometry = geometry(kernelShape);
            long address = kernels.createConvolutionDescriptor(geometry);
            LOG.fine(() -> "Created convolution descriptor 0x" + Long.toHexString(address) + " for " + geometry);
            return new NativeHandle(HANDLE_TYPE, address, kernels::destroyConvolutionDescriptor);
        });
        return List.of(handle);
    }
}
