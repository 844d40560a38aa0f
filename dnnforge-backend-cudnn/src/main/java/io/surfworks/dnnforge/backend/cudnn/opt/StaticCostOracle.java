package io.surfworks.dnnforge.backend.cudnn.opt;

import java.util.List;

import io.surfworks.dnnforge.core.graph.Node;

/**
 * Keeps the lowering the direction hint selects.
 */
public final class StaticCostOracle implements CostOracle {

    @Override
    public int choose(Node node, List<Candidate> candidates) {
        return 0;
    }
}
