package io.surfworks.dnnforge.core.rewrite;

import io.surfworks.dnnforge.core.graph.OperationGraph;

/**
 * A rewrite that sees the whole graph at once.
 */
public non-sealed interface GraphRewriter extends Rewrite {

    /**
     * Rewrites {@code graph} in place.
     *
     * @return true if the graph changed
     */
    boolean apply(OperationGraph graph);
}
