package io.surfworks.dnnforge.backend.cudnn.ops;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.ops.Elemwise;
import io.surfworks.dnnforge.core.tensor.ScalarType;

@DisplayName("AlgorithmCache")
class AlgorithmCacheTest {

    private static Node node() {
        Value x = Value.input(TensorType.ofRank(ScalarType.F32, 4), "x");
        return Elemwise.exp(x).owner();
    }

    @Test
    @DisplayName("once-per-node choices ignore the shapes")
    void once() {
        AlgorithmCache cache = new AlgorithmCache();
        AtomicInteger asked = new AtomicInteger();
        Node node = node();

        ForwardAlgorithm first = cache.resolve(node, false, List.of(1, 2), () -> {
            asked.incrementAndGet();
            return ForwardAlgorithm.LARGE;
        });
        ForwardAlgorithm second = cache.resolve(node, false, List.of(3, 4), () -> {
            asked.incrementAndGet();
            return ForwardAlgorithm.SMALL;
        });

        assertEquals(ForwardAlgorithm.LARGE, first);
        assertEquals(ForwardAlgorithm.LARGE, second);
        assertEquals(1, asked.get());
    }

    @Test
    @DisplayName("on-shape-change choices are kept per shape and per node")
    void perShape() {
        AlgorithmCache cache = new AlgorithmCache();
        AtomicInteger asked = new AtomicInteger();
        Node a = node();
        Node b = node();

        for (List<Integer> shapes : List.of(List.of(1, 2), List.of(3, 4), List.of(1, 2))) {
            cache.resolve(a, true, shapes, () -> {
                asked.incrementAndGet();
                return BackwardAlgorithm.NONE;
            });
        }
        cache.resolve(b, true, List.of(1, 2), () -> {
            asked.incrementAndGet();
            return BackwardAlgorithm.NONE;
        });

        assertEquals(3, asked.get());
        assertEquals(3, cache.size());
        cache.clear();
        assertEquals(0, cache.size());
    }
}
