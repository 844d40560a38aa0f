package io.surfworks.dnnforge.core.ops;

import java.util.List;

import io.surfworks.dnnforge.core.exec.ExecutionContext;
import io.surfworks.dnnforge.core.exec.Executable;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.Operator;
import io.surfworks.dnnforge.core.graph.OperatorKind;
import io.surfworks.dnnforge.core.graph.ShapeException;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.graph.ValueType;
import io.surfworks.dnnforge.core.kernel.ReferenceKernels;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * Gradient of max {@link Pool}: inputs are the image, the pooled output and
 * the gradient of the pooled output.
 */
public record MaxPoolGrad(List<Integer> window, List<Integer> stride, List<Integer> pad, boolean ignoreBorder)
        implements Operator, Executable {

    public static final OperatorKind KIND = OperatorKind.of("generic", "max_pool_grad");

    public MaxPoolGrad {
        window = List.copyOf(window);
        stride = List.copyOf(stride);
        pad = List.copyOf(pad);
        Pool.validateGeometry(window, stride, pad, ignoreBorder);
    }

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        if (inputs.size() != 3) {
            throw new ShapeException("MaxPoolGrad takes image, output and output gradient, got "
                    + inputs.size() + " inputs");
        }
        TensorType img = inputs.get(0).tensorType();
        Pool.checkImage("MaxPoolGrad", img, window.size());
        for (int i = 1; i < 3; i++) {
            if (inputs.get(i).tensorType().rank() != img.rank()) {
                throw new ShapeException("MaxPoolGrad input " + i + " must have rank " + img.rank()
                        + ", got " + inputs.get(i).tensorType());
            }
        }
        return List.of(img);
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        Tensor x = (Tensor) inputs.get(0);
        Tensor gz = (Tensor) inputs.get(2);
        return List.of(ReferenceKernels.poolingBackward(x, gz, Pool.ints(window), Pool.ints(stride),
                Pool.ints(pad), PoolMode.MAX));
    }
}
