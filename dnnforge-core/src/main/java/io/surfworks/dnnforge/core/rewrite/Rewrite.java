package io.surfworks.dnnforge.core.rewrite;

/**
 * Something a {@link RuleRegistry} can hold: a local {@link RewriteRule} or a
 * whole-graph {@link GraphRewriter}.
 */
public sealed interface Rewrite permits RewriteRule, GraphRewriter {

    /**
     * Name used in logs and {@link RewriteReport}s.
     */
    String name();
}
