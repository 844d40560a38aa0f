package io.surfworks.dnnforge.backend.cudnn.opt;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.surfworks.dnnforge.backend.cudnn.DnnRuntime;
import io.surfworks.dnnforge.backend.cudnn.ops.DnnSoftmaxGrad;
import io.surfworks.dnnforge.backend.cudnn.ops.SoftmaxAlgorithm;
import io.surfworks.dnnforge.backend.cudnn.ops.SoftmaxMode;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.ops.Contiguous;
import io.surfworks.dnnforge.core.ops.SoftmaxGrad;

/**
 * Matrix softmax gradient, lifted the same way as {@link LiftSoftmax}.
 */
public final class LiftSoftmaxGrad extends DnnRewriteRule {

    public static final String NAME = "local_softmax_dnn_grad";

    public LiftSoftmaxGrad(DnnRuntime runtime) {
        super(runtime, NAME, Set.of(SoftmaxGrad.KIND));
    }

    @Override
    protected Optional<List<Value>> rewriteAvailable(Node node, OperationGraph graph) {
        Value dy = Contiguous.of(LiftSoftmax.TO_IMAGE.call(node.input(0)));
        Value sm = Contiguous.of(LiftSoftmax.TO_IMAGE.call(node.input(1)));
        Value out = new DnnSoftmaxGrad(SoftmaxAlgorithm.ACCURATE, SoftmaxMode.CHANNEL).call(dy, sm);
        return Optional.of(List.of(LiftSoftmax.TO_MATRIX.call(out)));
    }
}
