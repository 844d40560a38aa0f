package io.surfworks.dnnforge.backend.cudnn.opt;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.surfworks.dnnforge.backend.cudnn.DnnRuntime;
import io.surfworks.dnnforge.backend.cudnn.ops.DnnSoftmax;
import io.surfworks.dnnforge.backend.cudnn.ops.SoftmaxAlgorithm;
import io.surfworks.dnnforge.backend.cudnn.ops.SoftmaxMode;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.ops.Contiguous;
import io.surfworks.dnnforge.core.ops.DimShuffle;
import io.surfworks.dnnforge.core.ops.Softmax;

/**
 * Runs a row-wise matrix softmax as a channel softmax over {@code [rows, cols, 1, 1]}.
 */
public final class LiftSoftmax extends DnnRewriteRule {

    public static final String NAME = "local_softmax_dnn";

    static final DimShuffle TO_IMAGE = DimShuffle.of(0, 1, DimShuffle.NEW_AXIS, DimShuffle.NEW_AXIS);
    static final DimShuffle TO_MATRIX = DimShuffle.of(0, 1);

    public LiftSoftmax(DnnRuntime runtime) {
        super(runtime, NAME, Set.of(Softmax.KIND));
    }

    @Override
    protected Optional<List<Value>> rewriteAvailable(Node node, OperationGraph graph) {
        Value image = Contiguous.of(TO_IMAGE.call(node.input(0)));
        Value out = new DnnSoftmax(SoftmaxAlgorithm.ACCURATE, SoftmaxMode.CHANNEL).call(image);
        return Optional.of(List.of(TO_MATRIX.call(out)));
    }
}
