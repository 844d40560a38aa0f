package io.surfworks.dnnforge.core.grad;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.dnnforge.core.graph.Differentiable;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.ShapeException;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.ops.Elemwise;
import io.surfworks.dnnforge.core.ops.FillLike;

/**
 * Reverse-mode differentiation as a graph-to-graph transformation.
 *
 * <p>Only nodes lying on a path from a {@code wrt} value to a differentiated
 * output are visited. Each visited node contributes through its operator's
 * {@link Differentiable#grad} rule; contributions reaching the same value are
 * summed.
 *
 * <p>Example:
 * <pre>{@code
 * Value cost = Sum.all(y);
 * List<Value> grads = Gradients.grad(cost, List.of(img, kerns));
 * }</pre>
 */
public final class Gradients {

    private static final Logger LOG = Logger.getLogger(Gradients.class.getName());

    private Gradients() {
    }

    /**
     * Gradients of a rank-0 {@code cost} with respect to each of {@code wrt}.
     */
    public static List<Value> grad(Value cost, List<Value> wrt) {
        TensorType t = cost.tensorType();
        if (t.rank() != 0) {
            throw new ShapeException("Cost must be a scalar, got " + t);
        }
        return grad(List.of(cost), List.of(FillLike.onesLike(cost)), wrt);
    }

    /**
     * Gradients of {@code outputs}, seeded with {@code outputGrads}, with respect
     * to each of {@code wrt}. A {@code wrt} value the outputs do not depend on
     * gets zeros.
     *
     * @throws GradientNotImplementedException if a required gradient is not implemented
     */
    public static List<Value> grad(List<Value> outputs, List<Value> outputGrads, List<Value> wrt) {
        if (outputs.size() != outputGrads.size()) {
            throw new IllegalArgumentException(outputs.size() + " outputs but " + outputGrads.size() + " seeds");
        }
        List<Node> order = topologicalOrder(outputs);
        Set<Value> targets = Collections.newSetFromMap(new IdentityHashMap<>());
        targets.addAll(wrt);
        Set<Node> needed = neededNodes(order, targets);

        Map<Value, List<Value>> contributions = new IdentityHashMap<>();
        for (int i = 0; i < outputs.size(); i++) {
            contributions.computeIfAbsent(outputs.get(i), k -> new ArrayList<>()).add(outputGrads.get(i));
        }

        for (int n = order.size() - 1; n >= 0; n--) {
            Node node = order.get(n);
            if (!needed.contains(node)) {
                continue;
            }
            List<Value> outGrads = new ArrayList<>(node.outputs().size());
            boolean any = false;
            Value marker = null;
            for (Value out : node.outputs()) {
                Value g = total(contributions.get(out));
                if (g != null) {
                    any = true;
                    if (isNotImplemented(g)) {
                        marker = g;
                    }
                }
                outGrads.add(g);
            }
            if (!any) {
                continue;
            }
            if (!(node.operator() instanceof Differentiable differentiable)) {
                throw new GradientNotImplementedException(node.operator().kind()
                        + " has no gradient but lies between the cost and " + wrt);
            }
            boolean[][] connected = differentiable.connectionPattern(node);
            List<Value> inputGrads;
            if (marker != null) {
                String reason = ((GradNotImplemented) marker.owner().operator()).reason();
                inputGrads = new ArrayList<>();
                for (Value in : node.inputs()) {
                    inputGrads.add(new GradNotImplemented(reason).call(in));
                }
            } else {
                for (int j = 0; j < outGrads.size(); j++) {
                    if (outGrads.get(j) == null && node.outputs().get(j).type() instanceof TensorType) {
                        outGrads.set(j, FillLike.zerosLike(node.outputs().get(j)));
                    }
                }
                inputGrads = differentiable.grad(node, outGrads);
            }
            LOG.finest(() -> "Differentiated " + node);
            for (int i = 0; i < node.inputs().size(); i++) {
                Value in = node.inputs().get(i);
                Value g = inputGrads.get(i);
                if (g == null || !isConnected(connected[i]) || !isNeeded(in, targets, needed)) {
                    continue;
                }
                contributions.computeIfAbsent(in, k -> new ArrayList<>()).add(g);
            }
        }

        List<Value> result = new ArrayList<>(wrt.size());
        for (Value w : wrt) {
            Value g = total(contributions.get(w));
            if (g == null) {
                g = FillLike.zerosLike(w);
            } else if (isNotImplemented(g)) {
                throw new GradientNotImplementedException("Gradient with respect to " + w + " is not implemented: "
                        + ((GradNotImplemented) g.owner().operator()).reason());
            }
            result.add(g);
        }
        return result;
    }

    /**
     * Placeholder for the gradient of {@code node}'s input {@code inputIndex}.
     */
    public static Value notImplemented(Node node, int inputIndex, String reason) {
        return new GradNotImplemented(node.operator().kind() + " input " + inputIndex + ": " + reason)
                .call(node.input(inputIndex));
    }

    public static boolean isNotImplemented(Value value) {
        return value.isProducedBy(GradNotImplemented.KIND);
    }

    private static Value total(List<Value> parts) {
        if (parts == null || parts.isEmpty()) {
            return null;
        }
        for (Value part : parts) {
            if (isNotImplemented(part)) {
                return part;
            }
        }
        Value sum = parts.get(0);
        for (int i = 1; i < parts.size(); i++) {
            sum = Elemwise.add(sum, parts.get(i));
        }
        return sum;
    }

    private static boolean isConnected(boolean[] row) {
        for (boolean b : row) {
            if (b) {
                return true;
            }
        }
        return false;
    }

    private static boolean isNeeded(Value value, Set<Value> targets, Set<Node> needed) {
        return targets.contains(value) || (value.owner() != null && needed.contains(value.owner()));
    }

    private static Set<Node> neededNodes(List<Node> order, Set<Value> targets) {
        Set<Node> needed = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Node node : order) {
            for (Value in : node.inputs()) {
                if (isNeeded(in, targets, needed)) {
                    needed.add(node);
                    break;
                }
            }
        }
        return needed;
    }

    private static List<Node> topologicalOrder(List<Value> outputs) {
        List<Node> order = new ArrayList<>();
        Set<Node> visited = new HashSet<>();
        Map<Node, Integer> cursor = new HashMap<>();
        Deque<Node> stack = new ArrayDeque<>();
        Map<Node, Boolean> roots = new LinkedHashMap<>();
        for (Value out : outputs) {
            if (out.owner() != null) {
                roots.put(out.owner(), Boolean.TRUE);
            }
        }
        for (Node root : roots.keySet()) {
            if (!visited.add(root)) {
                continue;
            }
            stack.push(root);
            while (!stack.isEmpty()) {
                Node top = stack.peek();
                int next = cursor.getOrDefault(top, 0);
                if (next < top.inputs().size()) {
                    cursor.put(top, next + 1);
                    Node producer = top.input(next).owner();
                    if (producer != null && visited.add(producer)) {
                        stack.push(producer);
                    }
                } else {
                    stack.pop();
                    order.add(top);
                }
            }
        }
        return order;
    }
}
