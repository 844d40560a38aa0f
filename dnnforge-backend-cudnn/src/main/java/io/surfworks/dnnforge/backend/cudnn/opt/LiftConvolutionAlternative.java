package io.surfworks.dnnforge.backend.cudnn.opt;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.surfworks.dnnforge.backend.cudnn.DnnRuntime;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.ops.Conv;
import io.surfworks.dnnforge.core.ops.DirectionHint;

/**
 * Lifts a unit-stride generic convolution through the opposite lowering from
 * the one its hint selects: full convolutions run forward, valid ones swap
 * between forward and the weight-gradient adjoint.
 */
public final class LiftConvolutionAlternative extends DnnRewriteRule {

    public static final String NAME = "local_conv_dnn_alternative";

    public LiftConvolutionAlternative(DnnRuntime runtime) {
        super(runtime, NAME, Set.of(Conv.KIND));
    }

    @Override
    protected Optional<List<Value>> rewriteAvailable(Node node, OperationGraph graph) {
        return oppositeHint((Conv) node.operator())
                .flatMap(hint -> LiftConvolution.lift(runtime, node, hint));
    }

    /**
     * The hint selecting the other lowering, or empty when there is no alternative.
     */
    static Optional<DirectionHint> oppositeHint(Conv conv) {
        if (!conv.subsample().stream().allMatch(s -> s == 1)) {
            return Optional.empty();
        }
        if (conv.border().isFull()) {
            return Optional.of(DirectionHint.FORCE_FORWARD);
        }
        if (conv.border().isValid()) {
            return Optional.of(conv.hint() == DirectionHint.BPROP_WEIGHTS
                    ? DirectionHint.FORWARD
                    : DirectionHint.BPROP_WEIGHTS);
        }
        return Optional.empty();
    }
}
