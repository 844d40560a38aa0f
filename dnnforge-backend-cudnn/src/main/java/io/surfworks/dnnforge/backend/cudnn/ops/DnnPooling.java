package io.surfworks.dnnforge.backend.cudnn.ops;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import io.surfworks.dnnforge.backend.cudnn.descriptor.PoolingDescriptorBuilder;
import io.surfworks.dnnforge.backend.cudnn.kernel.DnnKernels;
import io.surfworks.dnnforge.core.exec.Executable;
import io.surfworks.dnnforge.core.exec.ExecutionContext;
import io.surfworks.dnnforge.core.graph.ConfigurationException;
import io.surfworks.dnnforge.core.graph.Differentiable;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.Operator;
import io.surfworks.dnnforge.core.graph.OperatorKind;
import io.surfworks.dnnforge.core.graph.ShapeException;
import io.surfworks.dnnforge.core.graph.ShapeInferring;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.graph.ValueType;
import io.surfworks.dnnforge.core.kernel.ReferenceKernels;
import io.surfworks.dnnforge.core.ops.Contiguous;
import io.surfworks.dnnforge.core.resource.NativeHandle;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * Accelerated pooling: {@code (img, desc)}. The descriptor must come straight
 * from a {@link PoolingDescriptorBuilder}, whose geometry gives the output shape.
 */
public record DnnPooling() implements Operator, Executable, ShapeInferring, Differentiable {

    public static final OperatorKind KIND = OperatorKind.of("dnn", "pool");

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    /**
     * The builder that produced {@code desc}.
     *
     * @throws ConfigurationException if {@code desc} was not built by a {@link PoolingDescriptorBuilder}
     */
    static PoolingDescriptorBuilder descriptorOf(Value desc) {
        if (desc.owner() != null && desc.owner().operator() instanceof PoolingDescriptorBuilder builder) {
            return builder;
        }
        throw new ConfigurationException("Pooling descriptor input must be built by "
                + PoolingDescriptorBuilder.KIND + ", got " + desc);
    }

    static void checkImage(String what, TensorType img, PoolingDescriptorBuilder desc) {
        if (img.rank() != desc.spatialRank() + 2) {
            throw new ShapeException(what + " over " + desc.spatialRank() + " spatial axes needs a rank "
                    + (desc.spatialRank() + 2) + " image, got " + img);
        }
    }

    static List<Integer> outputShape(List<Integer> img, PoolingDescriptorBuilder desc) {
        List<Integer> out = new ArrayList<>(img.subList(0, 2));
        for (int d = 0; d < desc.spatialRank(); d++) {
            int size = img.get(d + 2);
            if (size == TensorType.UNKNOWN) {
                out.add(TensorType.UNKNOWN);
                continue;
            }
            int pooled = ReferenceKernels.outputSize(size, desc.window().get(d), desc.pad().get(d),
                    desc.stride().get(d));
            if (pooled < 1) {
                throw new ShapeException("Pooling output would be empty along spatial axis " + d + ": input "
                        + size + ", window " + desc.window().get(d) + ", pad " + desc.pad().get(d));
            }
            out.add(pooled);
        }
        return out;
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        if (inputs.size() != 2) {
            throw new ShapeException("Pooling takes an image and a descriptor, got " + inputs.size() + " inputs");
        }
        PoolingDescriptorBuilder desc = descriptorOf(inputs.get(1));
        TensorType img = inputs.get(0).tensorType();
        checkImage("Pooling", img, desc);
        return List.of(img.withShape(outputShape(img.shape(), desc)));
    }

    @Override
    public List<List<Integer>> inferShape(Node node, List<List<Integer>> inputShapes) {
        return List.of(outputShape(inputShapes.get(0), descriptorOf(node.input(1))));
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        NativeHandle desc = (NativeHandle) inputs.get(1);
        return List.of(context.service(DnnKernels.class).poolingForward(desc.address(), (Tensor) inputs.get(0)));
    }

    @Override
    public List<Value> grad(Node node, List<Value> outputGrads) {
        Value img = node.input(0);
        Value desc = node.input(1);
        Value gz = Contiguous.of(outputGrads.get(0));
        return Arrays.asList(new DnnPoolingGrad().call(img, node.output(), gz, desc), null);
    }

    @Override
    public boolean[][] connectionPattern(Node node) {
        return new boolean[][] {{true}, {false}};
    }
}
