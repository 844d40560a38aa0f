package io.surfworks.dnnforge.core.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A rewritable dataflow graph with def-use chain analysis.
 *
 * <p>OperationGraph tracks, for every value reachable from the outputs:
 * <ul>
 *   <li>Value → Node that produces it (producer)</li>
 *   <li>Value → list of uses (consuming node and input slot, or graph output position)</li>
 * </ul>
 *
 * <p>The graph is always a DAG over its declared inputs and constants. Rewrites
 * go through {@link #replace}, which imports the replacement subgraph, rewires
 * every use and prunes nodes that became unreachable.
 *
 * <p>Example:
 * <pre>{@code
 * OperationGraph graph = OperationGraph.of(List.of(x), List.of(y));
 *
 * // Check if a value has only one use (safe to overwrite in place)
 * boolean exclusive = graph.hasSingleUse(value);
 *
 * // Substitute an equivalent value
 * graph.replace(y, y2, "my-rule");
 * }</pre>
 */
public final class OperationGraph {

    private static final Logger LOG = Logger.getLogger(OperationGraph.class.getName());

    /**
     * One use of a value: input slot {@code index} of {@code node}, or graph
     * output position {@code index} when {@code node} is null.
     */
    public record Use(Node node, int index) {
        public boolean isGraphOutput() {
            return node == null;
        }
    }

    private final List<Value> inputs;
    private final List<Value> outputs;
    private final Set<Node> nodes = new LinkedHashSet<>();
    private final Map<Value, List<Use>> uses = new HashMap<>();

    private OperationGraph(List<Value> inputs) {
        this.inputs = List.copyOf(inputs);
        this.outputs = new ArrayList<>();
    }

    /**
     * Builds a graph from its inputs and outputs, importing every node between them.
     *
     * @throws IllegalArgumentException if an output depends on a free value that
     *         is neither a declared input nor a constant
     */
    public static OperationGraph of(List<Value> inputs, List<Value> outputs) {
        Set<Value> distinct = new HashSet<>(inputs);
        if (distinct.size() != inputs.size()) {
            throw new IllegalArgumentException("Graph inputs must be distinct");
        }
        for (Value input : inputs) {
            if (input.owner() != null || input.isConstant()) {
                throw new IllegalArgumentException("Graph input must be a free value: " + input);
            }
        }
        OperationGraph graph = new OperationGraph(inputs);
        for (Value output : outputs) {
            graph.importValue(output);
            graph.outputs.add(output);
            graph.addUse(output, new Use(null, graph.outputs.size() - 1));
        }
        return graph;
    }

    // ==================== Queries ====================

    public List<Value> inputs() {
        return inputs;
    }

    public List<Value> outputs() {
        return Collections.unmodifiableList(outputs);
    }

    /**
     * Returns the node that produces the given value.
     *
     * @return the producing node, or null if the value is a graph input or constant
     */
    public Node producer(Value value) {
        Node owner = value.owner();
        return owner != null && nodes.contains(owner) ? owner : null;
    }

    /**
     * Returns every use of the value, including graph-output positions.
     */
    public List<Use> uses(Value value) {
        return Collections.unmodifiableList(uses.getOrDefault(value, List.of()));
    }

    /**
     * Returns the distinct nodes consuming the value.
     */
    public List<Node> consumers(Value value) {
        Set<Node> result = new LinkedHashSet<>();
        for (Use use : uses(value)) {
            if (!use.isGraphOutput()) {
                result.add(use.node());
            }
        }
        return List.copyOf(result);
    }

    /**
     * Returns the number of times a value is used, counting graph outputs.
     */
    public int useCount(Value value) {
        return uses(value).size();
    }

    /**
     * Returns true if the value has exactly one use.
     *
     * <p>A value with a single use can be overwritten in place by that user.
     */
    public boolean hasSingleUse(Value value) {
        return useCount(value) == 1;
    }

    public boolean isUnused(Value value) {
        return useCount(value) == 0;
    }

    public boolean isGraphInput(Value value) {
        return inputs.contains(value);
    }

    public boolean isGraphOutput(Value value) {
        for (Use use : uses(value)) {
            if (use.isGraphOutput()) {
                return true;
            }
        }
        return false;
    }

    public boolean contains(Node node) {
        return nodes.contains(node);
    }

    /**
     * Returns the nodes in topological order (every node after the producers of its inputs).
     */
    public List<Node> nodes() {
        List<Node> order = new ArrayList<>(nodes.size());
        Set<Node> visited = new HashSet<>();
        for (Value output : outputs) {
            visit(output.owner(), visited, order);
        }
        return order;
    }

    private void visit(Node node, Set<Node> visited, List<Node> order) {
        if (node == null || !nodes.contains(node)) {
            return;
        }
        Deque<Object[]> stack = new ArrayDeque<>();
        if (!visited.add(node)) {
            return;
        }
        stack.push(new Object[] {node, 0});
        while (!stack.isEmpty()) {
            Object[] frame = stack.peek();
            Node current = (Node) frame[0];
            int next = (Integer) frame[1];
            if (next < current.inputs().size()) {
                frame[1] = next + 1;
                Node producer = producer(current.input(next));
                if (producer != null && visited.add(producer)) {
                    stack.push(new Object[] {producer, 0});
                }
            } else {
                stack.pop();
                order.add(current);
            }
        }
    }

    /**
     * Returns true if {@code value} is computed (transitively) from {@code target}.
     */
    public static boolean dependsOn(Value value, Value target) {
        Deque<Value> work = new ArrayDeque<>();
        Set<Node> seen = new HashSet<>();
        work.push(value);
        while (!work.isEmpty()) {
            Value v = work.pop();
            if (v == target) {
                return true;
            }
            Node owner = v.owner();
            if (owner != null && seen.add(owner)) {
                for (Value in : owner.inputs()) {
                    work.push(in);
                }
            }
        }
        return false;
    }

    // ==================== Mutation ====================

    /**
     * Replaces every use of {@code old} with {@code replacement}.
     *
     * @param reason a label for logging, usually the rule name
     * @throws ShapeException if the replacement's type is incompatible
     * @throws IllegalStateException if the replacement depends on {@code old}
     */
    public void replace(Value old, Value replacement, String reason) {
        if (old == replacement) {
            return;
        }
        if (!old.type().accepts(replacement.type())) {
            throw new ShapeException("Cannot replace " + old + " with " + replacement
                    + ": incompatible type (" + reason + ")");
        }
        if (dependsOn(replacement, old)) {
            throw new IllegalStateException("Replacing " + old + " would create a cycle (" + reason + ")");
        }
        importValue(replacement);

        List<Use> oldUses = new ArrayList<>(uses(old));
        for (Use use : oldUses) {
            if (use.isGraphOutput()) {
                outputs.set(use.index(), replacement);
            } else {
                use.node().setInput(use.index(), replacement);
            }
            addUse(replacement, use);
        }
        uses.remove(old);
        if (LOG.isLoggable(Level.FINEST)) {
            LOG.finest("replace " + old + " -> " + replacement + " (" + reason + ")");
        }
        prune(old.owner());
    }

    /**
     * Replaces each output of a node with the matching replacement, in order.
     */
    public void replaceAll(List<Value> olds, List<Value> replacements, String reason) {
        if (olds.size() != replacements.size()) {
            throw new IllegalArgumentException("Expected " + olds.size() + " replacements, got "
                    + replacements.size() + " (" + reason + ")");
        }
        for (int i = 0; i < olds.size(); i++) {
            Value replacement = replacements.get(i);
            if (replacement != null) {
                replace(olds.get(i), replacement, reason);
            }
        }
    }

    private void importValue(Value value) {
        Deque<Node> pending = new ArrayDeque<>();
        collectMissing(value, pending, new HashSet<>());
        // collectMissing pushes producers before consumers
        while (!pending.isEmpty()) {
            Node node = pending.removeLast();
            if (nodes.add(node)) {
                for (int i = 0; i < node.inputs().size(); i++) {
                    addUse(node.input(i), new Use(node, i));
                }
            }
        }
    }

    private void collectMissing(Value value, Deque<Node> pending, Set<Node> seen) {
        Node owner = value.owner();
        if (owner == null) {
            if (!value.isConstant() && !inputs.contains(value)) {
                throw new IllegalArgumentException(
                        "Value " + value + " is not computable from the graph inputs");
            }
            return;
        }
        if (nodes.contains(owner) || !seen.add(owner)) {
            return;
        }
        for (Value in : owner.inputs()) {
            collectMissing(in, pending, seen);
        }
        pending.push(owner);
    }

    private void prune(Node node) {
        if (node == null || !nodes.contains(node)) {
            return;
        }
        for (Value out : node.outputs()) {
            if (!isUnused(out)) {
                return;
            }
        }
        nodes.remove(node);
        for (Value out : node.outputs()) {
            uses.remove(out);
        }
        for (int i = 0; i < node.inputs().size(); i++) {
            Value in = node.input(i);
            List<Use> inUses = uses.get(in);
            if (inUses != null) {
                inUses.remove(new Use(node, i));
                if (inUses.isEmpty()) {
                    uses.remove(in);
                }
            }
            prune(in.owner());
        }
    }

    private void addUse(Value value, Use use) {
        uses.computeIfAbsent(value, k -> new ArrayList<>()).add(use);
    }

    @Override
    public String toString() {
        return String.format("OperationGraph[inputs=%d, nodes=%d, outputs=%d]",
                inputs.size(), nodes.size(), outputs.size());
    }
}
