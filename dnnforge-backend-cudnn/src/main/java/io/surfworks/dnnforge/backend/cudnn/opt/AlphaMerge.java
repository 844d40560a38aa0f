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
import io.surfworks.dnnforge.core.ops.Elemwise;
import io.surfworks.dnnforge.core.ops.ScalarOp;

/**
 * Folds {@code conv(...) * lr}, with {@code lr} a scalar, into the
 * convolution's α and β: {@code α' = lr·α} and {@code β' = lr·β}. A constant
 * zero β stays zero.
 *
 * <p>The convolution must have no consumer besides the multiplication.
 */
public final class AlphaMerge extends DnnRewriteRule {

    private final OperatorKind target;

    public AlphaMerge(DnnRuntime runtime, String name, OperatorKind target) {
        super(runtime, name, Set.of(Elemwise.KIND));
        this.target = target;
    }

    @Override
    protected Optional<List<Value>> rewriteAvailable(Node node, OperationGraph graph) {
        if (!Elemwise.isOp(node, ScalarOp.MUL)) {
            return Optional.empty();
        }
        for (int side = 0; side < 2; side++) {
            Value conv = node.input(side);
            Value lr = node.input(1 - side);
            if (conv.isProducedBy(target) && graph.hasSingleUse(conv) && isScalar(lr, conv)) {
                return Optional.of(List.of(merge(conv.owner(), lr)));
            }
        }
        return Optional.empty();
    }

    private static boolean isScalar(Value lr, Value like) {
        TensorType t = lr.tensorType();
        return t.rank() == 0 && t.dtype() == like.tensorType().dtype();
    }

    private static Value merge(Node conv, Value lr) {
        DnnConvolutionOp<?> op = (DnnConvolutionOp<?>) conv.operator();
        List<Value> inputs = new ArrayList<>(conv.inputs());
        inputs.set(DnnConvolutionOp.ALPHA, scale(lr, conv.input(DnnConvolutionOp.ALPHA)));
        Value beta = conv.input(DnnConvolutionOp.BETA);
        if (!(beta instanceof Constant c && c.isScalarEqualTo(0))) {
            inputs.set(DnnConvolutionOp.BETA, scale(lr, beta));
        }
        return op.withInplace(false).call(inputs.toArray(new Value[0]));
    }

    private static Value scale(Value lr, Value factor) {
        if (lr instanceof Constant a && factor instanceof Constant b) {
            return Constant.scalar(factor.tensorType().dtype(), a.scalarValue() * b.scalarValue());
        }
        if (factor instanceof Constant b && b.isScalarEqualTo(1)) {
            return lr;
        }
        return Elemwise.mul(lr, factor);
    }
}
