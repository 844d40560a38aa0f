package io.surfworks.dnnforge.core.rewrite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Prioritized rewrite table, built once and handed to {@link RewriteDriver}.
 *
 * <p>Each entry is keyed by pass name, priority and tag set. Lower priorities
 * run first; equal priorities run in registration order.
 */
public final class RuleRegistry {

    /**
     * One registration.
     *
     * @param pass pass the rewrite belongs to
     * @param priority position within the pass, lowest first
     * @param tags names a query can include or exclude
     * @param rewrite the rule or graph rewriter
     * @param sequence registration order, breaks priority ties
     */
    public record Entry(String pass, int priority, Set<String> tags, Rewrite rewrite, long sequence) {

        public Entry {
            Objects.requireNonNull(pass, "pass");
            Objects.requireNonNull(rewrite, "rewrite");
            tags = Set.copyOf(tags);
        }

        public boolean hasAny(Set<String> wanted) {
            for (String tag : wanted) {
                if (tags.contains(tag)) {
                    return true;
                }
            }
            return false;
        }
    }

    static final Comparator<Entry> ORDER =
            Comparator.comparingInt(Entry::priority).thenComparingLong(Entry::sequence);

    private final List<Entry> entries = new ArrayList<>();
    private long nextSequence;

    /**
     * Registers {@code rewrite} under ({@code pass}, {@code priority}, {@code tags}).
     *
     * @return this registry for chaining
     */
    public synchronized RuleRegistry register(String pass, int priority, Set<String> tags, Rewrite rewrite) {
        for (Entry e : entries) {
            if (e.rewrite().name().equals(rewrite.name()) && e.pass().equals(pass)) {
                throw new IllegalArgumentException("Rewrite '" + rewrite.name() + "' already registered in pass "
                        + pass);
            }
        }
        entries.add(new Entry(pass, priority, tags, rewrite, nextSequence++));
        return this;
    }

    /**
     * Entries carrying at least one of {@code include} and none of
     * {@code exclude}, in execution order.
     */
    public synchronized List<Entry> select(Set<String> include, Set<String> exclude) {
        List<Entry> selected = new ArrayList<>();
        for (Entry e : entries) {
            if (e.hasAny(include) && !e.hasAny(exclude)) {
                selected.add(e);
            }
        }
        selected.sort(ORDER);
        return selected;
    }

    public synchronized List<Entry> entries() {
        List<Entry> all = new ArrayList<>(entries);
        all.sort(ORDER);
        return Collections.unmodifiableList(all);
    }

    public synchronized int size() {
        return entries.size();
    }

    @Override
    public synchronized String toString() {
        return "RuleRegistry[entries=" + entries.size() + "]";
    }
}
