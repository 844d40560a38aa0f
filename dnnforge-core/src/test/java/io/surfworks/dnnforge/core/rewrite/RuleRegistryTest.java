package io.surfworks.dnnforge.core.rewrite;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.graph.OperatorKind;
import io.surfworks.dnnforge.core.graph.Value;

@DisplayName("RuleRegistry")
class RuleRegistryTest {

    record Named(String name) implements RewriteRule {

        @Override
        public Set<OperatorKind> tracks() {
            return Set.of();
        }

        @Override
        public Optional<List<Value>> rewrite(Node node, OperationGraph graph) {
            return Optional.empty();
        }
    }

    private static List<String> names(List<RuleRegistry.Entry> entries) {
        return entries.stream().map(e -> e.rewrite().name()).toList();
    }

    @Test
    @DisplayName("orders by priority, then registration order")
    void ordersByPriorityThenSequence() {
        RuleRegistry registry = new RuleRegistry()
                .register("opt", 20, Set.of("fast_run"), new Named("b"))
                .register("opt", 0, Set.of("fast_run"), new Named("a"))
                .register("opt", 20, Set.of("fast_run"), new Named("c"))
                .register("opt", 70, Set.of("fast_run"), new Named("d"));

        assertEquals(List.of("a", "b", "c", "d"), names(registry.entries()));
    }

    @Test
    @DisplayName("selects entries by included and excluded tags")
    void selectsByTags() {
        RuleRegistry registry = new RuleRegistry()
                .register("opt", 20, Set.of("conv_dnn", "fast_run", "cudnn"), new Named("lift"))
                .register("meta", 10, Set.of("conv_meta"), new Named("meta"))
                .register("check", 0, Set.of("cudnn"), new Named("check"));

        assertEquals(List.of("check", "lift"), names(registry.select(Set.of("cudnn"), Set.of())));
        assertEquals(List.of("meta"), names(registry.select(Set.of("fast_run", "conv_meta"), Set.of("conv_dnn"))));
        assertEquals(List.of(), names(registry.select(Set.of("unknown"), Set.of())));
    }

    @Test
    @DisplayName("refuses a duplicate name within a pass")
    void refusesDuplicates() {
        RuleRegistry registry = new RuleRegistry().register("opt", 1, Set.of("x"), new Named("same"));

        assertThrows(IllegalArgumentException.class,
                () -> registry.register("opt", 2, Set.of("y"), new Named("same")));
        registry.register("other", 2, Set.of("y"), new Named("same"));
        assertEquals(2, registry.size());
    }
}
