package io.surfworks.dnnforge.core.graph;

import java.util.Arrays;
import java.util.List;

/**
 * An immutable description of a computation kind plus its fixed parameters.
 *
 * <p>Equality is by parameter set. Additional behavior is declared through the
 * capability interfaces {@link ShapeInferring}, {@link Differentiable},
 * {@link Aliasing} and {@link AlgorithmSelecting}.
 *
 * <p>Example:
 * <pre>{@code
 * Value doubled = new Elemwise(ScalarOp.MUL).call(x, Constant.scalar(ScalarType.F32, 2));
 * }</pre>
 */
public interface Operator {

    /**
     * The tag rewrite rules match against.
     */
    OperatorKind kind();

    /**
     * Validates the inputs and returns the types of the outputs.
     *
     * <p>Implementations must not have side effects: a failure leaves no trace
     * in any graph.
     *
     * @throws ShapeException if input ranks or element kinds are wrong
     * @throws ConfigurationException if the operator's parameters are inconsistent with the inputs
     */
    List<ValueType> outputTypes(List<Value> inputs);

    /**
     * Whether a constant-propagation pass may evaluate this operator ahead of
     * execution when all of its inputs are constant.
     */
    default boolean constantFoldable() {
        return true;
    }

    /**
     * Builds a node applying this operator.
     */
    default Node apply(Value... inputs) {
        return Node.create(this, Arrays.asList(inputs));
    }

    /**
     * Builds a node and returns its only output.
     */
    default Value call(Value... inputs) {
        Node node = apply(inputs);
        if (node.outputs().size() != 1) {
            throw new IllegalStateException(kind() + " has " + node.outputs().size() + " outputs");
        }
        return node.output();
    }
}
