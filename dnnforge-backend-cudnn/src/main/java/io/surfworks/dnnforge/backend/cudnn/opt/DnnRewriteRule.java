package io.surfworks.dnnforge.backend.cudnn.opt;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.surfworks.dnnforge.backend.cudnn.DnnRuntime;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.graph.OperatorKind;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.rewrite.RewriteRule;

/**
 * Base for local rules that only fire while the backend is available.
 */
public abstract class DnnRewriteRule implements RewriteRule {

    protected final DnnRuntime runtime;
    private final String name;
    private final Set<OperatorKind> tracks;

    protected DnnRewriteRule(DnnRuntime runtime, String name, Set<OperatorKind> tracks) {
        this.runtime = runtime;
        this.name = name;
        this.tracks = Set.copyOf(tracks);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Set<OperatorKind> tracks() {
        return tracks;
    }

    @Override
    public final Optional<List<Value>> rewrite(Node node, OperationGraph graph) {
        if (!runtime.isAvailable()) {
            return Optional.empty();
        }
        return rewriteAvailable(node, graph);
    }

    /**
     * Called only when the availability gate reports the backend usable.
     */
    protected abstract Optional<List<Value>> rewriteAvailable(Node node, OperationGraph graph);

    @Override
    public String toString() {
        return name;
    }
}
