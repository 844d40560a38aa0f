package io.surfworks.dnnforge.core.ops;

import java.util.ArrayList;
import java.util.List;

import io.surfworks.dnnforge.core.exec.ExecutionContext;
import io.surfworks.dnnforge.core.exec.Executable;
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
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * Generic pooling over the trailing {@code window.size()} axes.
 *
 * <p>With {@code ignoreBorder} false a partial window at the end of an axis
 * still produces an output; padding is then not allowed.
 */
public record Pool(List<Integer> window, List<Integer> stride, List<Integer> pad, PoolMode mode,
                   boolean ignoreBorder) implements Operator, Executable, ShapeInferring, Differentiable {

    public static final OperatorKind KIND = OperatorKind.of("generic", "pool");

    public Pool {
        window = List.copyOf(window);
        stride = List.copyOf(stride);
        pad = List.copyOf(pad);
        validateGeometry(window, stride, pad, ignoreBorder);
    }

    static void validateGeometry(List<Integer> window, List<Integer> stride, List<Integer> pad,
                                 boolean ignoreBorder) {
        if (window.size() != stride.size() || window.size() != pad.size()) {
            throw new ConfigurationException("Pool window " + window + ", stride " + stride + " and pad " + pad
                    + " must have the same length");
        }
        for (int d = 0; d < window.size(); d++) {
            if (window.get(d) < 1 || stride.get(d) < 1) {
                throw new ConfigurationException("Pool window " + window + " and stride " + stride
                        + " must be positive");
            }
            if (pad.get(d) < 0 || pad.get(d) >= window.get(d)) {
                throw new ConfigurationException("Pool pad " + pad + " must be non-negative and smaller than window "
                        + window);
            }
            if (!ignoreBorder && pad.get(d) != 0) {
                throw new ConfigurationException("Pool padding " + pad + " requires ignoreBorder");
            }
        }
    }

    /**
     * Output length of one pooled axis of length {@code size}.
     */
    public static int outputSize(int size, int window, int stride, int pad, boolean ignoreBorder) {
        if (ignoreBorder) {
            return ReferenceKernels.outputSize(size, window, pad, stride);
        }
        if (stride >= window) {
            return (size - 1) / stride + 1;
        }
        return Math.max(0, Math.floorDiv(size - 1 - window + stride, stride)) + 1;
    }

    static List<Integer> outputShape(List<Integer> input, List<Integer> window, List<Integer> stride,
                                     List<Integer> pad, boolean ignoreBorder) {
        int nd = window.size();
        int lead = input.size() - nd;
        List<Integer> out = new ArrayList<>(input.subList(0, lead));
        for (int d = 0; d < nd; d++) {
            int size = input.get(lead + d);
            out.add(size == TensorType.UNKNOWN
                    ? TensorType.UNKNOWN
                    : outputSize(size, window.get(d), stride.get(d), pad.get(d), ignoreBorder));
        }
        return out;
    }

    static void checkImage(String what, TensorType img, int nd) {
        if (img.rank() != nd + 2) {
            throw new ShapeException(what + " over " + nd + " spatial axes needs a rank " + (nd + 2)
                    + " image, got " + img);
        }
    }

    static int[] ints(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).toArray();
    }

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        if (inputs.size() != 1) {
            throw new ShapeException("Pool takes one input, got " + inputs.size());
        }
        TensorType img = inputs.get(0).tensorType();
        checkImage("Pool", img, window.size());
        return List.of(img.withShape(outputShape(img.shape(), window, stride, pad, ignoreBorder)));
    }

    @Override
    public List<List<Integer>> inferShape(Node node, List<List<Integer>> inputShapes) {
        return List.of(outputShape(inputShapes.get(0), window, stride, pad, ignoreBorder));
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        Tensor x = (Tensor) inputs.get(0);
        List<Integer> shape = new ArrayList<>();
        for (int d : x.shape()) {
            shape.add(d);
        }
        int[] outShape = ints(outputShape(shape, window, stride, pad, ignoreBorder));
        return List.of(ReferenceKernels.poolingForward(x, outShape, ints(window), ints(stride), ints(pad), mode));
    }

    @Override
    public List<Value> grad(Node node, List<Value> outputGrads) {
        Value x = node.input(0);
        Value gz = outputGrads.get(0);
        if (mode == PoolMode.MAX) {
            return List.of(new MaxPoolGrad(window, stride, pad, ignoreBorder).call(x, node.output(), gz));
        }
        return List.of(new AveragePoolGrad(window, stride, pad, mode, ignoreBorder).call(x, gz));
    }
}
