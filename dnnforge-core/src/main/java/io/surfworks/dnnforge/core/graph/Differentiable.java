package io.surfworks.dnnforge.core.graph;

import java.util.Arrays;
import java.util.List;

/**
 * Capability: builds the gradient subgraph of an operator.
 */
public interface Differentiable {

    /**
     * Returns one gradient per input of {@code node}, given one gradient per output.
     * A null entry marks an input that is disconnected from every output.
     */
    List<Value> grad(Node node, List<Value> outputGrads);

    /**
     * {@code result[i][j]} is true when output {@code j} depends on input {@code i}.
     * Defaults to fully connected.
     */
    default boolean[][] connectionPattern(Node node) {
        boolean[][] pattern = new boolean[node.inputs().size()][node.outputs().size()];
        for (boolean[] row : pattern) {
            Arrays.fill(row, true);
        }
        return pattern;
    }
}
