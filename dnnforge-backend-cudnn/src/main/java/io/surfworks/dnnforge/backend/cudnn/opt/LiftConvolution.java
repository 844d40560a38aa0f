package io.surfworks.dnnforge.backend.cudnn.opt;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.surfworks.dnnforge.backend.cudnn.Dnn;
import io.surfworks.dnnforge.backend.cudnn.DnnRuntime;
import io.surfworks.dnnforge.backend.cudnn.ops.ConvMode;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.ops.Conv;
import io.surfworks.dnnforge.core.ops.DirectionHint;

/**
 * Replaces a generic "valid" or "full" convolution with the accelerated
 * subgraph {@link Dnn#convolution} builds for its direction hint.
 */
public final class LiftConvolution extends DnnRewriteRule {

    public static final String NAME = "local_conv_dnn";

    public LiftConvolution(DnnRuntime runtime) {
        super(runtime, NAME, Set.of(Conv.KIND));
    }

    @Override
    protected Optional<List<Value>> rewriteAvailable(Node node, OperationGraph graph) {
        Conv conv = (Conv) node.operator();
        return lift(runtime, node, conv.hint());
    }

    /**
     * Lifts {@code node} with the given hint, or returns empty when the backend cannot run it.
     */
    static Optional<List<Value>> lift(DnnRuntime runtime, Node node, DirectionHint hint) {
        Conv conv = (Conv) node.operator();
        if (!conv.border().isValid() && !conv.border().isFull()) {
            return Optional.empty();
        }
        if (!Dnn.canLower(runtime, conv.spatialRank(), Dnn.chooseLowering(conv.border(), conv.subsample(), hint))) {
            return Optional.empty();
        }
        Value out = Dnn.convolution(runtime, node.input(0), node.input(1), conv.border(), conv.subsample(),
                ConvMode.CONVOLUTION, hint, null);
        return Optional.of(List.of(out));
    }
}
