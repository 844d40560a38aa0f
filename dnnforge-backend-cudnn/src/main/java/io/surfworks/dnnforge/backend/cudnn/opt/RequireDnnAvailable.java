package io.surfworks.dnnforge.backend.cudnn.opt;

import java.util.logging.Logger;

import io.surfworks.dnnforge.backend.cudnn.DnnRuntime;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.rewrite.GraphRewriter;
import io.surfworks.dnnforge.core.rewrite.OptimizationAbortedException;

/**
 * Aborts the optimization run when accelerated rewrites were requested but the
 * backend cannot be used. Never changes the graph.
 */
public final class RequireDnnAvailable implements GraphRewriter {

    private static final Logger LOG = Logger.getLogger(RequireDnnAvailable.class.getName());

    public static final String NAME = "require_dnn_available";

    private final DnnRuntime runtime;

    public RequireDnnAvailable(DnnRuntime runtime) {
        this.runtime = runtime;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean apply(OperationGraph graph) {
        if (runtime.isAvailable()) {
            return false;
        }
        String message = "cuDNN optimization was enabled, but the backend cannot be used. We got this error: \n"
                + runtime.gate().reason().orElse("unknown reason");
        LOG.severe(message);
        throw new OptimizationAbortedException(message);
    }
}
