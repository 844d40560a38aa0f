package io.surfworks.dnnforge.core.rewrite;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.graph.Value;

/**
 * Applies the rewrites selected from a {@link RuleRegistry} to a graph.
 *
 * <p>Passes run in order of their lowest registered priority. Inside a pass,
 * entries run in priority order: a graph rewriter runs once at its position,
 * and each run of consecutive local rules is applied over the whole graph
 * until none of them fires. For every node the first matching rule wins.
 *
 * <p>Example:
 * <pre>{@code
 * RewriteReport report = RewriteDriver.optimize(graph, registry, Set.of("fast_run"), Set.of());
 * }</pre>
 */
public final class RewriteDriver {

    private static final Logger LOG = Logger.getLogger(RewriteDriver.class.getName());

    /** Upper bound on sweeps of one local-rule group before the run is declared divergent. */
    static final int MAX_SWEEPS = 1000;

    private RewriteDriver() {
    }

    public static RewriteReport optimize(OperationGraph graph, RuleRegistry registry, Set<String> include) {
        return optimize(graph, registry, include, Set.of());
    }

    /**
     * Runs every entry tagged with one of {@code include} and none of {@code exclude}.
     *
     * @throws OptimizationAbortedException if a rewrite aborts the run
     * @throws IllegalStateException if local rules keep firing without reaching a fixpoint
     */
    public static RewriteReport optimize(OperationGraph graph, RuleRegistry registry, Set<String> include,
                                         Set<String> exclude) {
        RewriteReport report = new RewriteReport();
        Map<String, List<RuleRegistry.Entry>> passes = new LinkedHashMap<>();
        // select() is sorted, so passes appear in order of their lowest priority
        for (RuleRegistry.Entry entry : registry.select(include, exclude)) {
            passes.computeIfAbsent(entry.pass(), k -> new ArrayList<>()).add(entry);
        }
        for (Map.Entry<String, List<RuleRegistry.Entry>> pass : passes.entrySet()) {
            runPass(graph, pass.getKey(), pass.getValue(), report);
        }
        LOG.fine(() -> "Rewrite run finished with " + report.total() + " firings over " + passes.keySet());
        return report;
    }

    private static void runPass(OperationGraph graph, String pass, List<RuleRegistry.Entry> entries,
                                RewriteReport report) {
        List<RewriteRule> group = new ArrayList<>();
        for (RuleRegistry.Entry entry : entries) {
            if (entry.rewrite() instanceof RewriteRule rule) {
                group.add(rule);
                continue;
            }
            runLocal(graph, pass, group, report);
            group.clear();
            GraphRewriter rewriter = (GraphRewriter) entry.rewrite();
            if (rewriter.apply(graph)) {
                report.record(pass, rewriter.name(), graph.toString());
                LOG.fine(() -> pass + ": " + rewriter.name() + " changed the graph");
            }
        }
        runLocal(graph, pass, group, report);
    }

    private static void runLocal(OperationGraph graph, String pass, List<RewriteRule> rules, RewriteReport report) {
        if (rules.isEmpty()) {
            return;
        }
        for (int sweep = 0; sweep < MAX_SWEEPS; sweep++) {
            boolean changed = false;
            for (Node node : graph.nodes()) {
                if (graph.contains(node) && applyFirst(graph, pass, rules, node, report)) {
                    changed = true;
                }
            }
            if (!changed) {
                return;
            }
        }
        throw new IllegalStateException("Pass " + pass + " did not reach a fixpoint after " + MAX_SWEEPS
                + " sweeps");
    }

    private static boolean applyFirst(OperationGraph graph, String pass, List<RewriteRule> rules, Node node,
                                      RewriteReport report) {
        for (RewriteRule rule : rules) {
            if (!rule.tracks().isEmpty() && !rule.tracks().contains(node.operator().kind())) {
                continue;
            }
            Optional<List<Value>> replacement = rule.rewrite(node, graph);
            if (replacement.isEmpty()) {
                continue;
            }
            String target = node.toString();
            graph.replaceAll(node.outputs(), replacement.get(), rule.name());
            report.record(pass, rule.name(), target);
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine(pass + ": " + rule.name() + " rewrote " + target);
            }
            return true;
        }
        return false;
    }
}
