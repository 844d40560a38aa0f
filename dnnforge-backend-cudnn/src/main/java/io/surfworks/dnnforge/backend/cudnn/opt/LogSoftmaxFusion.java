package io.surfworks.dnnforge.backend.cudnn.opt;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.surfworks.dnnforge.backend.cudnn.DnnFeature;
import io.surfworks.dnnforge.backend.cudnn.DnnRuntime;
import io.surfworks.dnnforge.backend.cudnn.ops.DnnSoftmax;
import io.surfworks.dnnforge.backend.cudnn.ops.SoftmaxAlgorithm;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.ops.DimShuffle;
import io.surfworks.dnnforge.core.ops.Elemwise;
import io.surfworks.dnnforge.core.ops.ScalarOp;

/**
 * Replaces {@code log(softmax(x))} with a single log-softmax when the softmax
 * has no other consumer. Looks through one single-consumer dimshuffle, which
 * is how a lifted matrix softmax reaches its logarithm.
 */
public final class LogSoftmaxFusion extends DnnRewriteRule {

    public static final String NAME = "local_log_softmax_dnn";

    public LogSoftmaxFusion(DnnRuntime runtime) {
        super(runtime, NAME, Set.of(Elemwise.KIND));
    }

    @Override
    protected Optional<List<Value>> rewriteAvailable(Node node, OperationGraph graph) {
        if (!Elemwise.isOp(node, ScalarOp.LOG) || !runtime.supports(DnnFeature.LOG_SOFTMAX)) {
            return Optional.empty();
        }
        Value in = node.input(0);
        DimShuffle shuffle = null;
        if (in.isProducedBy(DimShuffle.KIND) && graph.hasSingleUse(in)) {
            shuffle = (DimShuffle) in.owner().operator();
            in = in.owner().input(0);
        }
        if (!in.isProducedBy(DnnSoftmax.KIND) || !graph.hasSingleUse(in)) {
            return Optional.empty();
        }
        DnnSoftmax softmax = (DnnSoftmax) in.owner().operator();
        if (softmax.algorithm() == SoftmaxAlgorithm.LOG) {
            return Optional.empty();
        }
        Value fused = DnnSoftmax.create(runtime, SoftmaxAlgorithm.LOG, softmax.mode()).call(in.owner().input(0));
        return Optional.of(List.of(shuffle != null ? shuffle.call(fused) : fused));
    }
}
