package io.surfworks.dnnforge.backend.cudnn.ops;

import java.util.List;

import io.surfworks.dnnforge.backend.cudnn.descriptor.PoolingDescriptorBuilder;
import io.surfworks.dnnforge.backend.cudnn.kernel.DnnKernels;
import io.surfworks.dnnforge.core.exec.Executable;
import io.surfworks.dnnforge.core.exec.ExecutionContext;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.Operator;
import io.surfworks.dnnforge.core.graph.OperatorKind;
import io.surfworks.dnnforge.core.graph.ShapeException;
import io.surfworks.dnnforge.core.graph.ShapeInferring;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.graph.ValueType;
import io.surfworks.dnnforge.core.resource.NativeHandle;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * Gradient of {@link DnnPooling}: {@code (img, out, dout, desc)}, returning a
 * tensor shaped like {@code img}. Has no gradient of its own.
 */
public record DnnPoolingGrad() implements Operator, Executable, ShapeInferring {

    public static final OperatorKind KIND = OperatorKind.of("dnn", "pool_grad");

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        if (inputs.size() != 4) {
            throw new ShapeException("Pooling gradient takes (img, out, dout, desc), got " + inputs.size()
                    + " inputs");
        }
        PoolingDescriptorBuilder desc = DnnPooling.descriptorOf(inputs.get(3));
        TensorType img = inputs.get(0).tensorType();
        DnnPooling.checkImage("Pooling gradient", img, desc);
        for (int i = 1; i <= 2; i++) {
            TensorType t = inputs.get(i).tensorType();
            if (t.rank() != img.rank() || t.dtype() != img.dtype()) {
                throw new ShapeException("Pooling gradient input " + i + " must match the image's rank and type "
                        + img + ", got " + t);
            }
        }
        return List.of(img);
    }

    @Override
    public List<List<Integer>> inferShape(Node node, List<List<Integer>> inputShapes) {
        return List.of(inputShapes.get(0));
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        NativeHandle desc = (NativeHandle) inputs.get(3);
        return List.of(context.service(DnnKernels.class).poolingBackward(desc.address(), (Tensor) inputs.get(0),
                (Tensor) inputs.get(1), (Tensor) inputs.get(2)));
    }
}
