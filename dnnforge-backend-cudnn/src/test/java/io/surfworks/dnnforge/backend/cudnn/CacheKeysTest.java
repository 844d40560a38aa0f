package io.surfworks.dnnforge.backend.cudnn;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.surfworks.dnnforge.backend.cudnn.ops.ConvMode;
import io.surfworks.dnnforge.backend.cudnn.ops.DnnConvolution;
import io.surfworks.dnnforge.backend.cudnn.ops.ForwardAlgorithm;
import io.surfworks.dnnforge.backend.cudnn.opt.DnnRewrites;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.ops.BorderMode;
import io.surfworks.dnnforge.core.ops.DirectionHint;
import io.surfworks.dnnforge.core.rewrite.RuleRegistry;
import io.surfworks.dnnforge.core.tensor.ScalarType;

@DisplayName("CacheKeys")
class CacheKeysTest {

    private static final DnnRuntime V5 = TestRuntimes.available(5005);

    private static OperationGraph convolution(BorderMode border) {
        Value img = Value.input(TensorType.of(ScalarType.F32, 2, 3, 8, 8), "img");
        Value kerns = Value.input(TensorType.of(ScalarType.F32, 4, 3, 3, 3), "kerns");
        Value out = Dnn.convolution(V5, img, kerns, border, List.of(1, 1), ConvMode.CONVOLUTION,
                DirectionHint.FORCE_FORWARD, null);
        return OperationGraph.of(List.of(img, kerns), List.of(out));
    }

    @Test
    @DisplayName("operator keys are stable and end with the backend version")
    void operatorKeys() {
        String key = CacheKeys.forOperator(new DnnConvolution(ForwardAlgorithm.SMALL), 5005);

        assertEquals(key, CacheKeys.forOperator(new DnnConvolution(ForwardAlgorithm.SMALL), 5005));
        assertTrue(key.matches("[0-9a-f]{64}-v5005"), key);
        assertNotEquals(key, CacheKeys.forOperator(new DnnConvolution(ForwardAlgorithm.LARGE), 5005));
        assertNotEquals(key, CacheKeys.forOperator(new DnnConvolution(ForwardAlgorithm.SMALL, true), 5005));
    }

    @Test
    @DisplayName("a backend version change invalidates every key")
    void versionSensitive() {
        OperationGraph graph = convolution(BorderMode.VALID);

        assertNotEquals(CacheKeys.forGraph(graph, 5005), CacheKeys.forGraph(graph, 5103));
        assertNotEquals(CacheKeys.forOperator(new DnnConvolution(ForwardAlgorithm.SMALL), 5005),
                CacheKeys.forOperator(new DnnConvolution(ForwardAlgorithm.SMALL), 4007));
    }

    @Test
    @DisplayName("graph keys follow structure, not identity")
    void graphKeys() {
        assertEquals(CacheKeys.forGraph(convolution(BorderMode.VALID), 5005),
                CacheKeys.forGraph(convolution(BorderMode.VALID), 5005));
        assertNotEquals(CacheKeys.forGraph(convolution(BorderMode.VALID), 5005),
                CacheKeys.forGraph(convolution(BorderMode.FULL), 5005));
    }

    @Test
    @DisplayName("registry keys cover every registered rewrite")
    void registryKeys() {
        RuleRegistry a = DnnRewrites.registerAll(new RuleRegistry(), V5);
        RuleRegistry b = DnnRewrites.registerAll(new RuleRegistry(), V5);
        RuleRegistry checkOnly = new RuleRegistry();

        assertEquals(CacheKeys.forRegistry(a, 5005), CacheKeys.forRegistry(b, 5005));
        assertNotEquals(CacheKeys.forRegistry(a, 5005), CacheKeys.forRegistry(checkOnly, 5005));
    }
}
