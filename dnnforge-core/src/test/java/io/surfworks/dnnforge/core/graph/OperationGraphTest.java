package io.surfworks.dnnforge.core.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.dnnforge.core.ops.Elemwise;
import io.surfworks.dnnforge.core.ops.ScalarOp;
import io.surfworks.dnnforge.core.tensor.ScalarType;

@DisplayName("OperationGraph")
class OperationGraphTest {

    private static final TensorType MATRIX = TensorType.of(ScalarType.F32, 4, 8);

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("imports every node between inputs and outputs")
        void importsNodes() {
            Value x = Value.input(MATRIX, "x");
            Value y = Value.input(MATRIX, "y");
            Value sum = Elemwise.add(x, y);
            Value out = Elemwise.exp(sum);

            OperationGraph graph = OperationGraph.of(List.of(x, y), List.of(out));

            assertEquals(2, graph.nodes().size());
            assertSame(sum.owner(), graph.producer(sum));
            assertEquals(List.of(sum.owner()), graph.consumers(x));
            assertTrue(graph.isGraphOutput(out));
            assertTrue(graph.isGraphInput(x));
        }

        @Test
        @DisplayName("rejects outputs that depend on an undeclared free value")
        void rejectsFreeValues() {
            Value x = Value.input(MATRIX, "x");
            Value stray = Value.input(MATRIX, "stray");
            Value out = Elemwise.add(x, stray);

            assertThrows(IllegalArgumentException.class, () -> OperationGraph.of(List.of(x), List.of(out)));
        }

        @Test
        @DisplayName("constants need not be declared as inputs")
        void constantsAreFree() {
            Value x = Value.input(MATRIX, "x");
            Value out = Elemwise.mul(x, Constant.scalar(ScalarType.F32, 2));

            OperationGraph graph = OperationGraph.of(List.of(x), List.of(out));

            assertEquals(1, graph.nodes().size());
        }

        @Test
        @DisplayName("invalid node construction fails without touching the graph")
        void constructionIsAtomic() {
            Value x = Value.input(MATRIX, "x");
            Value v = Value.input(TensorType.of(ScalarType.F32, 8), "v");
            Value out = Elemwise.exp(x);
            OperationGraph graph = OperationGraph.of(List.of(x, v), List.of(out));

            assertThrows(ShapeException.class, () -> new Elemwise(ScalarOp.ADD).apply(out, v));
            assertEquals(1, graph.useCount(out));
            assertEquals(1, graph.nodes().size());
        }
    }

    @Nested
    @DisplayName("Def-use analysis")
    class DefUse {

        @Test
        @DisplayName("counts graph outputs as uses")
        void graphOutputsAreUses() {
            Value x = Value.input(MATRIX, "x");
            Value e = Elemwise.exp(x);
            Value out = Elemwise.log(e);

            OperationGraph graph = OperationGraph.of(List.of(x), List.of(out, e));

            assertEquals(2, graph.useCount(e));
            assertFalse(graph.hasSingleUse(e));
            assertTrue(graph.hasSingleUse(out));
        }

        @Test
        @DisplayName("nodes() lists producers before consumers")
        void topologicalOrder() {
            Value x = Value.input(MATRIX, "x");
            Value a = Elemwise.exp(x);
            Value b = Elemwise.log(a);
            Value c = Elemwise.add(a, b);

            List<Node> order = OperationGraph.of(List.of(x), List.of(c)).nodes();

            assertEquals(List.of(a.owner(), b.owner(), c.owner()), order);
        }

        @Test
        @DisplayName("dependsOn follows producers transitively")
        void dependsOn() {
            Value x = Value.input(MATRIX, "x");
            Value a = Elemwise.exp(x);
            Value b = Elemwise.log(a);

            assertTrue(OperationGraph.dependsOn(b, x));
            assertFalse(OperationGraph.dependsOn(x, b));
        }
    }

    @Nested
    @DisplayName("Replacement")
    class Replacement {

        @Test
        @DisplayName("rewires every use and prunes the dead producer")
        void rewiresAndPrunes() {
            Value x = Value.input(MATRIX, "x");
            Value e = Elemwise.exp(x);
            Value out = Elemwise.log(e);
            OperationGraph graph = OperationGraph.of(List.of(x), List.of(out));

            Value replacement = Elemwise.mul(x, Constant.scalar(ScalarType.F32, 1));
            graph.replace(out, replacement, "test");

            assertEquals(List.of(replacement), graph.outputs());
            assertFalse(graph.contains(e.owner()));
            assertFalse(graph.contains(out.owner()));
            assertEquals(1, graph.nodes().size());
        }

        @Test
        @DisplayName("rewires inner uses in place")
        void rewiresInnerUses() {
            Value x = Value.input(MATRIX, "x");
            Value e = Elemwise.exp(x);
            Value out = Elemwise.log(e);
            OperationGraph graph = OperationGraph.of(List.of(x), List.of(out));

            Value e2 = Elemwise.add(x, x);
            graph.replace(e, e2, "test");

            assertSame(e2, out.owner().input(0));
            assertEquals(List.of(out.owner()), graph.consumers(e2));
            assertTrue(graph.isUnused(e));
        }

        @Test
        @DisplayName("rejects replacements of an incompatible type")
        void rejectsIncompatibleType() {
            Value x = Value.input(MATRIX, "x");
            Value out = Elemwise.exp(x);
            OperationGraph graph = OperationGraph.of(List.of(x), List.of(out));
            Value other = Value.input(TensorType.of(ScalarType.F64, 4, 8), "other");

            assertThrows(ShapeException.class, () -> graph.replace(out, other, "test"));
        }

        @Test
        @DisplayName("rejects replacements that would create a cycle")
        void rejectsCycles() {
            Value x = Value.input(MATRIX, "x");
            Value e = Elemwise.exp(x);
            Value out = Elemwise.log(e);
            OperationGraph graph = OperationGraph.of(List.of(x), List.of(out));

            assertThrows(IllegalStateException.class, () -> graph.replace(e, Elemwise.exp(out), "test"));
        }

        @Test
        @DisplayName("unknown dimensions are compatible with any size, known ones must agree")
        void typeCompatibility() {
            Value x = Value.input(TensorType.ofRank(ScalarType.F32, 2), "x");
            Value out = Elemwise.exp(x);
            OperationGraph graph = OperationGraph.of(List.of(x), List.of(out));

            assertTrue(out.type().accepts(MATRIX));
            assertTrue(MATRIX.accepts(out.type()));
            assertFalse(MATRIX.accepts(TensorType.of(ScalarType.F32, 4, 7)));
            graph.replace(out, Elemwise.log(x), "test");
            assertEquals(1, graph.nodes().size());
        }
    }
}
