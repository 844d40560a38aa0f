package io.surfworks.dnnforge.backend.cudnn.opt;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.surfworks.dnnforge.backend.cudnn.DnnRuntime;
import io.surfworks.dnnforge.backend.cudnn.ops.DnnConvolutionOp;
import io.surfworks.dnnforge.core.graph.Constant;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.graph.OperatorKind;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.ops.Contiguous;
import io.surfworks.dnnforge.core.ops.Elemwise;
import io.surfworks.dnnforge.core.ops.ScalarOp;

/**
 * Folds {@code conv(..., out, ..., β = 0) + w} into {@code conv(..., contiguous(w), ..., β = 1)}.
 *
 * <p>{@code w} must have the type and broadcast pattern of the output buffer,
 * and the convolution must have no consumer besides the addition.
 */
public final class OutputMerge extends DnnRewriteRule {

    private final OperatorKind target;

    public OutputMerge(DnnRuntime runtime, String name, OperatorKind target) {
        super(runtime, name, Set.of(Elemwise.KIND));
        this.target = target;
    }

    @Override
    protected Optional<List<Value>> rewriteAvailable(Node node, OperationGraph graph) {
        if (!Elemwise.isOp(node, ScalarOp.ADD)) {
            return Optional.empty();
        }
        for (int side = 0; side < 2; side++) {
            Value conv = node.input(side);
            Value w = node.input(1 - side);
            if (conv.isProducedBy(target) && graph.hasSingleUse(conv) && mergeable(conv.owner(), w)) {
                return Optional.of(List.of(merge(conv.owner(), w)));
            }
        }
        return Optional.empty();
    }

    private static boolean mergeable(Node conv, Value w) {
        Value beta = conv.input(DnnConvolutionOp.BETA);
        if (!(beta instanceof Constant c && c.isScalarEqualTo(0))) {
            return false;
        }
        TensorType out = conv.input(DnnConvolutionOp.OUTPUT).tensorType();
        TensorType accumulator = w.tensorType();
        return out.accepts(accumulator) && out.broadcastPattern().equals(accumulator.broadcastPattern());
    }

    private static Value merge(Node conv, Value w) {
        DnnConvolutionOp<?> op = (DnnConvolutionOp<?>) conv.operator();
        List<Value> inputs = new ArrayList<>(conv.inputs());
        inputs.set(DnnConvolutionOp.OUTPUT, Contiguous.of(w));
        inputs.set(DnnConvolutionOp.BETA, Constant.scalar(w.tensorType().dtype(), 1));
        return op.withInplace(false).call(inputs.toArray(new Value[0]));
    }
}
