package io.surfworks.dnnforge.backend.cudnn.opt;

import java.util.List;

import io.surfworks.dnnforge.backend.cudnn.ConvolutionLowering;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.Value;

/**
 * Chooses between equivalent accelerated lowerings of one generic convolution.
 */
@FunctionalInterface
public interface CostOracle {

    /**
     * One lowering of the node, not yet wired into the graph.
     *
     * @param rule the rule that built it
     */
    record Candidate(String rule, ConvolutionLowering lowering, Value output) {
    }

    /**
     * Returns the index of the candidate to keep. The first candidate is the
     * one the node's own hint selects.
     */
    int choose(Node node, List<Candidate> candidates);
}
