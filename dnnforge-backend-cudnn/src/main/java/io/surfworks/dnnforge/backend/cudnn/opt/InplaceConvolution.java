package io.surfworks.dnnforge.backend.cudnn.opt;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.surfworks.dnnforge.backend.cudnn.DnnRuntime;
import io.surfworks.dnnforge.backend.cudnn.ops.DnnConvolutionOp;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.graph.OperatorKind;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.ops.AllocEmpty;

/**
 * Lets an accelerated convolution write into its freshly allocated output
 * buffer. A buffer with other consumers is first replaced by a private copy
 * of the allocation, so a destroyed buffer always has exactly one consumer.
 *
 * <p>Buffers that are not fresh allocations are left alone.
 */
public final class InplaceConvolution extends DnnRewriteRule {

    public InplaceConvolution(DnnRuntime runtime, String name, OperatorKind kind) {
        super(runtime, name, Set.of(kind));
    }

    @Override
    protected Optional<List<Value>> rewriteAvailable(Node node, OperationGraph graph) {
        DnnConvolutionOp<?> op = (DnnConvolutionOp<?>) node.operator();
        if (op.inplace()) {
            return Optional.empty();
        }
        Value dest = node.input(DnnConvolutionOp.OUTPUT);
        if (!dest.isProducedBy(AllocEmpty.KIND)) {
            return Optional.empty();
        }
        List<Value> inputs = new ArrayList<>(node.inputs());
        if (graph.useCount(dest) > 1) {
            Node alloc = dest.owner();
            inputs.set(DnnConvolutionOp.OUTPUT, alloc.operator().call(alloc.inputs().toArray(new Value[0])));
        }
        return Optional.of(List.of(op.withInplace(true).call(inputs.toArray(new Value[0]))));
    }
}
