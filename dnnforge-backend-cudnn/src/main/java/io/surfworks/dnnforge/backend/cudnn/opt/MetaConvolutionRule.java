package io.surfworks.dnnforge.backend.cudnn.opt;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.dnnforge.backend.cudnn.Dnn;
import io.surfworks.dnnforge.backend.cudnn.DnnRuntime;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.ops.Conv;
import io.surfworks.dnnforge.core.ops.DirectionHint;

/**
 * Builds both the hinted and the opposite lowering of a generic convolution
 * and keeps the one a {@link CostOracle} picks.
 */
public final class MetaConvolutionRule extends DnnRewriteRule {

    private static final Logger LOG = Logger.getLogger(MetaConvolutionRule.class.getName());

    public static final String NAME = "local_conv_dnn_meta";

    private final CostOracle oracle;

    public MetaConvolutionRule(DnnRuntime runtime, CostOracle oracle) {
        super(runtime, NAME, Set.of(Conv.KIND));
        this.oracle = oracle;
    }

    @Override
    protected Optional<List<Value>> rewriteAvailable(Node node, OperationGraph graph) {
        Conv conv = (Conv) node.operator();
        List<CostOracle.Candidate> candidates = new ArrayList<>(2);
        addCandidate(candidates, LiftConvolution.NAME, node, conv, conv.hint());
        LiftConvolutionAlternative.oppositeHint(conv)
                .ifPresent(hint -> addCandidate(candidates, LiftConvolutionAlternative.NAME, node, conv, hint));
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        int choice = candidates.size() == 1 ? 0 : oracle.choose(node, List.copyOf(candidates));
        if (choice < 0 || choice >= candidates.size()) {
            throw new IllegalStateException("Cost oracle chose candidate " + choice + " of " + candidates.size());
        }
        CostOracle.Candidate chosen = candidates.get(choice);
        LOG.fine(() -> "Chose " + chosen.lowering() + " from " + chosen.rule() + " for " + node);
        return Optional.of(List.of(chosen.output()));
    }

    private void addCandidate(List<CostOracle.Candidate> candidates, String rule, Node node, Conv conv,
                              DirectionHint hint) {
        LiftConvolution.lift(runtime, node, hint).ifPresent(outputs -> candidates.add(new CostOracle.Candidate(
                rule, Dnn.chooseLowering(conv.border(), conv.subsample(), hint), outputs.get(0))));
    }
}
