package io.surfworks.dnnforge.core.ops;

import java.util.ArrayList;
import java.util.List;

import io.surfworks.dnnforge.core.exec.ExecutionContext;
import io.surfworks.dnnforge.core.exec.Executable;
import io.surfworks.dnnforge.core.graph.ConfigurationException;
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
 * Generic (unaccelerated) convolution of a {@code [batch, channel, spatial...]}
 * image with {@code [out_channel, channel, kernel...]} filters. Filters are
 * flipped, so this is a true convolution rather than a cross-correlation.
 *
 * @param border padding policy
 * @param subsample stride per spatial axis
 * @param hint which lowering an accelerated rewrite should prefer
 */
public record Conv(BorderMode border, List<Integer> subsample, DirectionHint hint)
        implements Operator, Executable, ShapeInferring {

    public static final OperatorKind KIND = OperatorKind.of("generic", "conv");

    public Conv {
        subsample = List.copyOf(subsample);
        if (subsample.size() != 2 && subsample.size() != 3) {
            throw new ConfigurationException("Conv subsample must have 2 or 3 entries, got " + subsample);
        }
        for (int s : subsample) {
            if (s < 1) {
                throw new ConfigurationException("Conv subsample entries must be positive, got " + subsample);
            }
        }
        if (border.kind() == BorderMode.Kind.EXPLICIT && border.pads().size() != subsample.size()) {
            throw new ConfigurationException("Conv padding " + border + " does not match subsample " + subsample);
        }
    }

    public Conv(BorderMode border, List<Integer> subsample) {
        this(border, subsample, DirectionHint.NONE);
    }

    public int spatialRank() {
        return subsample.size();
    }

    @Override
    public OperatorKind kind() {
        return KIND;
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        if (inputs.size() != 2) {
            throw new ShapeException("Conv takes an image and filters, got " + inputs.size() + " inputs");
        }
        TensorType img = inputs.get(0).tensorType();
        TensorType kerns = inputs.get(1).tensorType();
        int rank = spatialRank() + 2;
        if (img.rank() != rank || kerns.rank() != rank) {
            throw new ShapeException("Conv with " + spatialRank() + " spatial axes needs rank " + rank
                    + " operands, got " + img + " and " + kerns);
        }
        if (img.dtype() != kerns.dtype()) {
            throw new ShapeException("Conv operands differ in element type: " + img + " and " + kerns);
        }
        if (img.isKnown(1) && kerns.isKnown(1) && img.dim(1) != kerns.dim(1)) {
            throw new ShapeException("Conv image has " + img.dim(1) + " channels but filters expect "
                    + kerns.dim(1));
        }
        return List.of(img.withShape(outputShape(img.shape(), kerns.shape())));
    }

    private List<Integer> outputShape(List<Integer> img, List<Integer> kerns) {
        List<Integer> out = new ArrayList<>(img.size());
        out.add(img.get(0));
        out.add(kerns.get(0));
        BorderMode resolved = border.expandTo(spatialRank());
        for (int d = 0; d < spatialRank(); d++) {
            int in = img.get(d + 2);
            int k = kerns.get(d + 2);
            if (in == TensorType.UNKNOWN || k == TensorType.UNKNOWN) {
                out.add(TensorType.UNKNOWN);
                continue;
            }
            int pad = switch (resolved.kind()) {
                case VALID -> 0;
                case FULL -> k - 1;
                case UNIFORM, EXPLICIT -> resolved.pads().get(d);
            };
            int size = ReferenceKernels.outputSize(in, k, pad, subsample.get(d));
            if (size < 1) {
                throw new ShapeException("Conv output would be empty along spatial axis " + d
                        + ": input " + in + ", kernel " + k + ", pad " + pad);
            }
            out.add(size);
        }
        return out;
    }

    @Override
    public List<List<Integer>> inferShape(Node node, List<List<Integer>> inputShapes) {
        return List.of(outputShape(inputShapes.get(0), inputShapes.get(1)));
    }

    @Override
    public List<Object> perform(Node node, List<Object> inputs, ExecutionContext context) {
        Tensor img = (Tensor) inputs.get(0);
        Tensor kerns = (Tensor) inputs.get(1);
        List<Integer> shape = outputShape(toList(img.shape()), toList(kerns.shape()));
        Tensor out = Tensor.zeros(img.dtype(), shape.stream().mapToInt(Integer::intValue).toArray());
        int[] kernelSpatial = new int[spatialRank()];
        for (int d = 0; d < kernelSpatial.length; d++) {
            kernelSpatial[d] = kerns.dim(d + 2);
        }
        int[] pads = border.expandTo(spatialRank()).resolve(kernelSpatial);
        int[] strides = subsample.stream().mapToInt(Integer::intValue).toArray();
        ReferenceKernels.convolutionForward(img, kerns, out, pads, strides, true, 1, 0);
        return List.of(out);
    }

    private static List<Integer> toList(int[] shape) {
        List<Integer> list = new ArrayList<>(shape.length);
        for (int d : shape) {
            list.add(d);
        }
        return list;
    }
}
