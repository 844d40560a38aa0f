package io.surfworks.dnnforge.core.rewrite;

import java.util.ArrayList;
import java.util.List;

/**
 * What a {@link RewriteDriver} run did.
 */
public final class RewriteReport {

    /**
     * One successful rewrite.
     *
     * @param pass pass in which it fired
     * @param rewrite name of the rule or graph rewriter
     * @param target the node rewritten, or the graph for a graph rewriter
     */
    public record Firing(String pass, String rewrite, String target) {}

    private final List<Firing> firings = new ArrayList<>();

    void record(String pass, String rewrite, String target) {
        firings.add(new Firing(pass, rewrite, target));
    }

    public List<Firing> firings() {
        return List.copyOf(firings);
    }

    public int count(String rewrite) {
        int n = 0;
        for (Firing f : firings) {
            if (f.rewrite().equals(rewrite)) {
                n++;
            }
        }
        return n;
    }

    public boolean fired(String rewrite) {
        return count(rewrite) > 0;
    }

    public int total() {
        return firings.size();
    }

    @Override
    public String toString() {
        return String.format("RewriteReport[firings=%d]", firings.size());
    }
}
