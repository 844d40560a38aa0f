package io.surfworks.dnnforge.backend.cudnn.ops;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import io.surfworks.dnnforge.core.graph.Node;

/**
 * Remembers the concrete algorithm chosen for automatic convolution
 * strategies, either once per node or once per node and input shape.
 *
 * <p>Shared across executions; thread-safe.
 */
public final class AlgorithmCache {

    private record Key(Node node, List<Integer> shapes) {
    }

    private final Map<Key, Enum<?>> choices = new ConcurrentHashMap<>();

    /**
     * Returns the cached choice for {@code node}, asking {@code chooser} on a miss.
     *
     * @param onShapeChange choose again for every distinct {@code shapes}
     * @param shapes the input shapes the choice depends on, flattened
     */
    @SuppressWarnings("unchecked")
    public <A extends Enum<A>> A resolve(Node node, boolean onShapeChange, List<Integer> shapes,
                                         Supplier<A> chooser) {
        Key key = new Key(node, onShapeChange ? List.copyOf(shapes) : List.of());
        return (A) choices.computeIfAbsent(key, k -> chooser.get());
    }

    public int size() {
        return choices.size();
    }

    public void clear() {
        choices.clear();
    }
}
