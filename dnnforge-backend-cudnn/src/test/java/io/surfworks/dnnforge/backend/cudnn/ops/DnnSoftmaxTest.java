package io.surfworks.dnnforge.backend.cudnn.ops;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.surfworks.dnnforge.backend.cudnn.DnnRuntime;
import io.surfworks.dnnforge.backend.cudnn.FeatureUnsupportedException;
import io.surfworks.dnnforge.backend.cudnn.TestRuntimes;
import io.surfworks.dnnforge.backend.cudnn.kernel.ReferenceDnnKernels;
import io.surfworks.dnnforge.core.exec.ExecutionContext;
import io.surfworks.dnnforge.core.exec.GraphInterpreter;
import io.surfworks.dnnforge.core.grad.GradientVerifier;
import io.surfworks.dnnforge.core.graph.ConfigurationException;
import io.surfworks.dnnforge.core.graph.Constant;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.graph.ShapeException;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.ops.Elemwise;
import io.surfworks.dnnforge.core.ops.Sum;
import io.surfworks.dnnforge.core.tensor.ScalarType;
import io.surfworks.dnnforge.core.tensor.Tensor;

@DisplayName("DnnSoftmax")
class DnnSoftmaxTest {

    private static final DnnRuntime V5 = TestRuntimes.available(5005);

    private static Tensor random(Random rng, int... shape) {
        Tensor t = Tensor.zeros(ScalarType.F64, shape);
        Tensor.forEachIndex(shape, idx -> t.set(rng.nextDouble() * 4 - 2, idx));
        return t;
    }

    private static Tensor run(Value x, Value out, Tensor value) {
        try (ExecutionContext context = V5.newExecutionContext(new ReferenceDnnKernels())) {
            return GraphInterpreter.evaluateTensor(OperationGraph.of(List.of(x), List.of(out)), Map.of(x, value),
                    context);
        }
    }

    @Test
    @DisplayName("channel mode normalizes over axis 1 at every position")
    void channelMode() {
        Value x = Value.input(TensorType.of(ScalarType.F64, 2, 3, 2, 2), "x");
        Tensor result = run(x, new DnnSoftmax(SoftmaxAlgorithm.ACCURATE, SoftmaxMode.CHANNEL).call(x),
                random(new Random(47), 2, 3, 2, 2));

        for (int n = 0; n < 2; n++) {
            for (int h = 0; h < 2; h++) {
                for (int w = 0; w < 2; w++) {
                    double total = 0;
                    for (int c = 0; c < 3; c++) {
                        total += result.get(n, c, h, w);
                    }
                    assertEquals(1.0, total, 1e-12);
                }
            }
        }
    }

    @Test
    @DisplayName("instance mode normalizes over everything but the batch axis")
    void instanceMode() {
        Value x = Value.input(TensorType.of(ScalarType.F64, 2, 3, 2, 2), "x");
        Tensor result = run(x, new DnnSoftmax(SoftmaxAlgorithm.FAST, SoftmaxMode.INSTANCE).call(x),
                random(new Random(53), 2, 3, 2, 2));

        double[] flat = result.toArray();
        for (int n = 0; n < 2; n++) {
            double total = 0;
            for (int i = 0; i < 12; i++) {
                total += flat[n * 12 + i];
            }
            assertEquals(1.0, total, 1e-12);
        }
    }

    @Test
    @DisplayName("the log algorithm is the logarithm of the accurate one")
    void logAlgorithm() {
        Value x = Value.input(TensorType.of(ScalarType.F64, 1, 4, 1, 3), "x");
        Tensor value = random(new Random(59), 1, 4, 1, 3);

        double[] plain = run(x, new DnnSoftmax(SoftmaxAlgorithm.ACCURATE, SoftmaxMode.CHANNEL).call(x), value)
                .toArray();
        double[] log = run(x, DnnSoftmax.create(V5, SoftmaxAlgorithm.LOG, SoftmaxMode.CHANNEL).call(x), value)
                .toArray();

        for (int i = 0; i < plain.length; i++) {
            plain[i] = Math.log(plain[i]);
        }
        assertArrayEquals(plain, log, 1e-12);
    }

    @Test
    @DisplayName("gradients match finite differences for every algorithm and mode")
    void gradients() {
        Random rng = new Random(61);
        for (SoftmaxAlgorithm algorithm : SoftmaxAlgorithm.values()) {
            for (SoftmaxMode mode : SoftmaxMode.values()) {
                Value x = Value.input(TensorType.of(ScalarType.F64, 2, 3, 2, 1), "x");
                Value sm = new DnnSoftmax(algorithm, mode).call(x);
                Value cost = Sum.all(Elemwise.mul(sm, Constant.of(random(rng, 2, 3, 2, 1))));

                GradientVerifier.Result result = GradientVerifier.check(List.of(x), cost,
                        Map.of(x, random(rng, 2, 3, 2, 1)),
                        () -> V5.newExecutionContext(new ReferenceDnnKernels()), 1e-6);

                assertTrue(result.passes(1e-6), algorithm + " " + mode + ": " + result);
            }
        }
    }

    @Test
    @DisplayName("needs rank 4, and a v3 backend for the log algorithm")
    void rejects() {
        Value matrix = Value.input(TensorType.of(ScalarType.F32, 2, 3), "m");

        assertThrows(ShapeException.class,
                () -> new DnnSoftmax(SoftmaxAlgorithm.ACCURATE, SoftmaxMode.CHANNEL).call(matrix));
        assertThrows(FeatureUnsupportedException.class, () -> DnnSoftmax.create(TestRuntimes.available(2000),
                SoftmaxAlgorithm.LOG, SoftmaxMode.CHANNEL));
        assertThrows(ConfigurationException.class, () -> SoftmaxAlgorithm.parse("exact"));
    }
}
