package io.surfworks.dnnforge.core.rewrite;

import java.util.List;
import java.util.logging.Logger;

import io.surfworks.dnnforge.core.exec.Executable;
import io.surfworks.dnnforge.core.exec.ExecutionContext;
import io.surfworks.dnnforge.core.graph.Constant;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * Evaluates nodes whose inputs are all constants and replaces their outputs
 * with constants. Operators that return false from
 * {@code Operator.constantFoldable()} are left alone.
 */
public final class ConstantFolding implements GraphRewriter {

    private static final Logger LOG = Logger.getLogger(ConstantFolding.class.getName());

    @Override
    public String name() {
        return "constant_folding";
    }

    @Override
    public boolean apply(OperationGraph graph) {
        boolean changed = false;
        for (Node node : graph.nodes()) {
            if (!graph.contains(node) || !isFoldable(node)) {
                continue;
            }
            List<Object> results;
            try (ExecutionContext context = new ExecutionContext()) {
                List<Object> args = node.inputs().stream().map(v -> (Object) ((Constant) v).data()).toList();
                results = ((Executable) node.operator()).perform(node, args, context);
            }
            for (int i = 0; i < results.size(); i++) {
                graph.replace(node.outputs().get(i), Constant.of((Tensor) results.get(i)), name());
            }
            LOG.finer(() -> "Folded " + node);
            changed = true;
        }
        return changed;
    }

    private static boolean isFoldable(Node node) {
        if (!node.operator().constantFoldable() || !(node.operator() instanceof Executable)) {
            return false;
        }
        if (node.inputs().isEmpty()) {
            return false;
        }
        for (Value in : node.inputs()) {
            if (!in.isConstant()) {
                return false;
            }
        }
        for (Value out : node.outputs()) {
            if (!(out.type() instanceof TensorType)) {
                return false;
            }
        }
        return true;
    }
}
