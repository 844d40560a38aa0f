package io.surfworks.dnnforge.backend.cudnn.ops;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.surfworks.dnnforge.backend.cudnn.DnnFeature;
import io.surfworks.dnnforge.backend.cudnn.DnnRuntime;
import io.surfworks.dnnforge.backend.cudnn.descriptor.ConvolutionDescriptorBuilder;
import io.surfworks.dnnforge.core.exec.Executable;
import io.surfworks.dnnforge.core.graph.AlgorithmSelecting;
import io.surfworks.dnnforge.core.graph.Aliasing;
import io.surfworks.dnnforge.core.graph.ConfigurationException;
import io.surfworks.dnnforge.core.graph.Constant;
import io.surfworks.dnnforge.core.graph.Differentiable;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.Operator;
import io.surfworks.dnnforge.core.graph.ShapeException;
import io.surfworks.dnnforge.core.graph.ShapeInferring;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.graph.ValueType;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * The three accelerated convolution operators. Each takes
 * {@code (a, b, out, descriptor, alpha, beta)} and returns
 * {@code alpha * op(a, b) + beta * out}, shaped like {@code out}.
 *
 * <p>With {@code inplace} set the result is written into the {@code out}
 * buffer, which is then no longer readable by anyone else.
 *
 * @param <A> the algorithm enumeration
 */
public sealed interface DnnConvolutionOp<A extends Enum<A>>
        extends Operator, Executable, ShapeInferring, Differentiable, Aliasing, AlgorithmSelecting<A>
        permits DnnConvolution, DnnConvolutionGradWeights, DnnConvolutionGradInputs {

    int OUTPUT = 2;
    int DESCRIPTOR = 3;
    int ALPHA = 4;
    int BETA = 5;

    boolean inplace();

    /**
     * The same operator with the given in-place flag.
     */
    DnnConvolutionOp<A> withInplace(boolean inplace);

    boolean supportsSpatialRank(int spatialRank);

    Optional<DnnFeature> requiredFeature();

    /**
     * Checks that the backend supports this operator's algorithm.
     *
     * @throws io.surfworks.dnnforge.backend.cudnn.FeatureUnsupportedException if it does not
     */
    default void checkSupported(DnnRuntime runtime) {
        requiredFeature().ifPresent(runtime::require);
    }

    @Override
    default List<ValueType> outputTypes(List<Value> inputs) {
        String name = kind().name();
        if (inputs.size() != 6) {
            throw new ShapeException(name + " takes (a, b, out, desc, alpha, beta), got " + inputs.size()
                    + " inputs");
        }
        TensorType a = inputs.get(0).tensorType();
        TensorType b = inputs.get(1).tensorType();
        TensorType out = inputs.get(OUTPUT).tensorType();
        if (out.rank() != 4 && out.rank() != 5) {
            throw new ShapeException(name + " needs rank 4 or 5 tensors, got " + out);
        }
        if (a.rank() != out.rank() || b.rank() != out.rank()) {
            throw new ShapeException(name + " tensor arguments must share one rank, got " + a + ", " + b
                    + " and " + out);
        }
        if (a.dtype() != out.dtype() || b.dtype() != out.dtype()) {
            throw new ShapeException(name + " tensor arguments must share one element type, got " + a + ", " + b
                    + " and " + out);
        }
        if (!ConvolutionDescriptorBuilder.HANDLE_TYPE.equals(inputs.get(DESCRIPTOR).type())) {
            throw new ShapeException(name + " input 3 must be a convolution descriptor, got "
                    + inputs.get(DESCRIPTOR).type());
        }
        for (int slot : new int[] {ALPHA, BETA}) {
            TensorType scale = inputs.get(slot).tensorType();
            if (scale.rank() != 0 || scale.dtype() != out.dtype()) {
                throw new ShapeException(name + (slot == ALPHA ? " alpha" : " beta") + " must be a "
                        + out.dtype().dtypeName() + " scalar, got " + scale);
            }
        }
        if (!supportsSpatialRank(out.rank() - 2)) {
            throw new ConfigurationException(name + " algorithm " + algorithm() + " is not supported with "
                    + (out.rank() - 2) + " spatial axes");
        }
        return List.of(out);
    }

    @Override
    default List<List<Integer>> inferShape(Node node, List<List<Integer>> inputShapes) {
        return List.of(inputShapes.get(OUTPUT));
    }

    @Override
    default Map<Integer, Integer> destroyMap() {
        return inplace() ? Map.of(0, OUTPUT) : Map.of();
    }

    @Override
    default boolean[][] connectionPattern(Node node) {
        return new boolean[][] {{true}, {true}, {true}, {false}, {true}, {true}};
    }

    // ==================== Helpers shared by the implementations ====================

    /**
     * The buffer to accumulate into: {@code out} itself when in place, otherwise a copy.
     */
    static Tensor target(Tensor out, boolean inplace) {
        return inplace ? out : out.copy();
    }

    static double scalar(Object tensor) {
        return ((Tensor) tensor).scalarValue();
    }

    static List<Integer> shapeKey(Tensor first, Tensor second) {
        List<Integer> key = new ArrayList<>(first.rank() + second.rank());
        for (int d : first.shape()) {
            key.add(d);
        }
        for (int d : second.shape()) {
            key.add(d);
        }
        return key;
    }

    static Value one(Value like) {
        return Constant.scalar(like.tensorType().dtype(), 1);
    }

    static Value zero(Value like) {
        return Constant.scalar(like.tensorType().dtype(), 0);
    }
}
