package io.surfworks.dnnforge.core.graph;

import java.util.List;

/**
 * Capability: computes output shapes from input shapes without running the operator.
 */
public interface ShapeInferring {

    /**
     * Infers the output shapes of {@code node}.
     *
     * @param node the node being inferred
     * @param inputShapes one shape per input; null for non-tensor inputs.
     *                    Dimensions may be {@link TensorType#UNKNOWN}.
     * @return one shape per output
     */
    List<List<Integer>> inferShape(Node node, List<List<Integer>> inputShapes);
}
