package io.surfworks.dnnforge.backend.cudnn.descriptor;

import java.util.List;
import java.util.logging.Logger;

import io.surfworks.dnnforge.backend.cudnn.DnnFeature;
import io.surfworks.dnnforge.backend.cudnn.DnnRuntime;
import io.surfworks.dnnforge.backend.cudnn.kernel.DnnKernels;
import io.surfworks.dnnforge.backend.cudnn.kernel.PoolingGeometry;
import io.surfworks.dnnforge.core.exec.Executable;
import io.surfworks.dnnforge.core.exec.ExecutionContext;
import io.surfworks.dnnforge.core.graph.ConfigurationException;
import io.surfworks.dnnforge.core.graph.HandleType;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.Operator;
import io.surfworks.dnnforge.core.graph.OperatorKind;
import io.surfworks.dnnforge.core.graph.ShapeException;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.graph.ValueType;
import io.surfworks.dnnforge.core.ops.PoolMode;
import io.surfworks.dnnforge.core.resource.NativeHandle;
import io.surfworks.dnnforge.core.resource.ResourceKey;

/**
 * Builds a native pooling descriptor. Takes no inputs.
 */
public record PoolingDescriptorBuilder(List<Integer> window, List<Integer> stride, List<Integer> pad, PoolMode mode)
        implements Operator, Executable {

    private static final Logger LOG = Logger.getLogger(PoolingDescriptorBuilder.class.getName());

    public static final OperatorKind KIND = OperatorKind.of("dnn", "pool_desc");

    public static final HandleType HANDLE_TYPE =
            new HandleType("cudnnPoolingDescriptor_t", "cudnnDestroyPoolingDescriptor");

    public PoolingDescriptorBuilder {
        window = List.copyOf(window);
        stride = List.copyOf(stride);
        pad = List.copyOf(pad);
        if (window.size() != stride.size() || window.size() != pad.size()) {
            throw new ConfigurationException("Pooling window " + window + ", stride " + stride + " and pad " + pad
                    + " must have the same length");
        }
        if (window.size() != 2 && window.size() != 3) {
            throw new ConfigurationException("Pooling needs 2 or 3 spatial axes, got window " + window);
        }
        for (int d = 0; d < window.size(); d++) {
            if (window.get(d) < 1 || stride.get(d) < 1) {
                throw new ConfigurationException("Pooling window " + window + " and stride " + stride
                        + " must be positive");
            }
            if (pad.get(d) < 0) {
                throw new ConfigurationException("Pooling pad " + pad + " must be non-negative");
            }
        }
    }

    /**
     * @throws io.surfworks.dnnforge.backend.cudnn.FeatureUnsupportedException for 3-D on an old backend
     */
    public static PoolingDescriptorBuilder create(DnnRuntime runtime, List<Integer> window, List<Integer> stride,
                                                  List<Integer> pad, PoolMode mode) {
        PoolingDescriptorBuilder builder = new PoolingDescriptorBuilder(window, stride, pad, mode);
        if (builder.spatialRank() == 3) {
            runtime.require(DnnFeature.ND_DESCRIPTORS);
        }
        return builder;
    }

    public int spatialRank() {
        return window.size();
    }

    public PoolingGeometry geometry() {
        return new PoolingGeometry(window, stride, pad, mode);
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
        if (!inputs.isEmpty()) {
            throw new ShapeException("Pooling descriptor takes no inputs, got " + inputs.size());
        }
        return List.of(HANDLE_TYPE);
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        DnnRuntime runtime = context.service(DnnRuntime.class);
        DnnKernels kernels = context.service(DnnKernels.class);
        NativeHandle handle = context.resource(new ResourceKey(this, List.of(), runtime.version()), () -> {
            long address = kernels.createPoolingDescriptor(geometry());
            LOG.fine(() -> "Created pooling descriptor 0x" + Long.toHexString(address) + " for " + this);
            return new NativeHandle(HANDLE_TYPE, address, kernels::destroyPoolingDescriptor);
        });
        return List.of(handle);
    }
}
