package io.surfworks.dnnforge.core.ops;

import java.util.List;

import io.surfworks.dnnforge.core.exec.ExecutionContext;
import io.surfworks.dnnforge.core.exec.Executable;
import io.surfworks.dnnforge.core.graph.ConfigurationException;
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
 * Gradient of average {@link Pool}: inputs are the image and the gradient of
 * the pooled output.
 */
public record AveragePoolGrad(List<Integer> window, List<Integer> stride, List<Integer> pad, PoolMode mode,
                              boolean ignoreBorder) implements Operator, Executable {

    public static final OperatorKind KIND = OperatorKind.of("generic", "average_pool_grad");

    public AveragePoolGrad {
        window = List.copyOf(window);
        stride = List.copyOf(stride);
        pad = List.copyOf(pad);
        Pool.validateGeometry(window, stride, pad, ignoreBorder);
        if (!mode.isAverage()) {
            throw new ConfigurationException("AveragePoolGrad needs an averaging mode, got " + mode.text());
        }
    }

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        if (inputs.size() != 2) {
            throw new ShapeException("AveragePoolGrad takes image and output gradient, got "
                    + inputs.size() + " inputs");
        }
        TensorType img = inputs.get(0).tensorType();
        Pool.checkImage("AveragePoolGrad", img, window.size());
        if (inputs.get(1).tensorType().rank() != img.rank()) {
            throw new ShapeException("AveragePoolGrad output gradient must have rank " + img.rank()
                    + ", got " + inputs.get(1).tensorType());
        }
        return List.of(img);
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        Tensor x = (Tensor) inputs.get(0);
        Tensor gz = (Tensor) inputs.get(1);
        return List.of(ReferenceKernels.poolingBackward(x, gz, Pool.ints(window), Pool.ints(stride),
                Pool.ints(pad), mode));
    }
}
