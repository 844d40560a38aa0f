package io.surfworks.dnnforge.core.rewrite;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.graph.OperatorKind;
import io.surfworks.dnnforge.core.graph.Value;

/**
 * A local rewrite: pattern, guard and replacement builder for one node.
 *
 * <p>Rules must be semantics-preserving, and a rule must never match the
 * replacement it produced.
 */
public non-sealed interface RewriteRule extends Rewrite {

    /**
     * Operator kinds whose nodes this rule inspects. Empty means every node.
     */
    Set<OperatorKind> tracks();

    /**
     * Returns replacements for every output of {@code node}, or empty when the
     * rule does not apply. New nodes are built with {@code Operator.apply};
     * the driver wires them into {@code graph}. Implementations must not
     * mutate {@code graph} themselves.
     */
    Optional<List<Value>> rewrite(Node node, OperationGraph graph);
}
