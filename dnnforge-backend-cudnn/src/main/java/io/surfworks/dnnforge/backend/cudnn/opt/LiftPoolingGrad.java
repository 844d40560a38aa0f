package io.surfworks.dnnforge.backend.cudnn.opt;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.surfworks.dnnforge.backend.cudnn.DnnRuntime;
import io.surfworks.dnnforge.backend.cudnn.descriptor.PoolingDescriptorBuilder;
import io.surfworks.dnnforge.backend.cudnn.ops.DnnPoolingGrad;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.ops.AveragePoolGrad;
import io.surfworks.dnnforge.core.ops.Contiguous;
import io.surfworks.dnnforge.core.ops.MaxPoolGrad;
import io.surfworks.dnnforge.core.ops.PoolMode;

/**
 * Replaces generic max and average pooling gradients with the accelerated
 * pooling gradient. The average form passes the output gradient in both the
 * forward-output and gradient slots; the kernel only checks the former's shape.
 */
public final class LiftPoolingGrad extends DnnRewriteRule {

    public static final String NAME = "local_pool_dnn_grad";

    public LiftPoolingGrad(DnnRuntime runtime) {
        super(runtime, NAME, Set.of(MaxPoolGrad.KIND, AveragePoolGrad.KIND));
    }

    @Override
    protected Optional<List<Value>> rewriteAvailable(Node node, OperationGraph graph) {
        Value img = node.input(0);
        if (node.operator() instanceof MaxPoolGrad grad) {
            if (!grad.ignoreBorder() || !LiftPooling.fits(runtime, img, grad.window().size())) {
                return Optional.empty();
            }
            Value desc = PoolingDescriptorBuilder.create(runtime, grad.window(), grad.stride(), grad.pad(),
                    PoolMode.MAX).call();
            return Optional.of(List.of(new DnnPoolingGrad().call(Contiguous.of(img),
                    Contiguous.of(node.input(1)), Contiguous.of(node.input(2)), desc)));
        }
        AveragePoolGrad grad = (AveragePoolGrad) node.operator();
        if (!grad.ignoreBorder() || !LiftPooling.fits(runtime, img, grad.window().size())) {
            return Optional.empty();
        }
        Value desc = PoolingDescriptorBuilder.create(runtime, grad.window(), grad.stride(), grad.pad(),
                grad.mode()).call();
        Value gz = Contiguous.of(node.input(1));
        return Optional.of(List.of(new DnnPoolingGrad().call(Contiguous.of(img), gz, gz, desc)));
    }
}
