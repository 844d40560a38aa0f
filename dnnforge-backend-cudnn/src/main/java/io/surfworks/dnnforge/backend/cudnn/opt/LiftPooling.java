package io.surfworks.dnnforge.backend.cudnn.opt;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.surfworks.dnnforge.backend.cudnn.Dnn;
import io.surfworks.dnnforge.backend.cudnn.DnnFeature;
import io.surfworks.dnnforge.backend.cudnn.DnnRuntime;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.ops.Pool;

/**
 * Replaces a generic pool that ignores partial border windows with accelerated pooling.
 */
public final class LiftPooling extends DnnRewriteRule {

    public static final String NAME = "local_pool_dnn";

    public LiftPooling(DnnRuntime runtime) {
        super(runtime, NAME, Set.of(Pool.KIND));
    }

    @Override
    protected Optional<List<Value>> rewriteAvailable(Node node, OperationGraph graph) {
        Pool pool = (Pool) node.operator();
        Value img = node.input(0);
        if (!pool.ignoreBorder() || !fits(runtime, img, pool.window().size())) {
            return Optional.empty();
        }
        return Optional.of(List.of(Dnn.pooling(runtime, img, pool.window(), pool.stride(), pool.mode(),
                pool.pad())));
    }

    /**
     * True when {@code img} is {@code [batch, channel, spatial...]} with a spatial rank the backend supports.
     */
    static boolean fits(DnnRuntime runtime, Value img, int spatialRank) {
        if (spatialRank != 2 && spatialRank != 3) {
            return false;
        }
        if (img.tensorType().rank() != spatialRank + 2) {
            return false;
        }
        return spatialRank == 2 || runtime.supports(DnnFeature.ND_DESCRIPTORS);
    }
}
