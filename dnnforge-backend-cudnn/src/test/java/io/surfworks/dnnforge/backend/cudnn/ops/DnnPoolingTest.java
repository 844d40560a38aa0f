package io.surfworks.dnnforge.backend.cudnn.ops;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.surfworks.dnnforge.backend.cudnn.Dnn;
import io.surfworks.dnnforge.backend.cudnn.DnnRuntime;
import io.surfworks.dnnforge.backend.cudnn.TestRuntimes;
import io.surfworks.dnnforge.backend.cudnn.descriptor.PoolingDescriptorBuilder;
import io.surfworks.dnnforge.backend.cudnn.kernel.ReferenceDnnKernels;
import io.surfworks.dnnforge.core.grad.GradientVerifier;
import io.surfworks.dnnforge.core.graph.ConfigurationException;
import io.surfworks.dnnforge.core.graph.Constant;
import io.surfworks.dnnforge.core.graph.ShapeException;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.ops.Elemwise;
import io.surfworks.dnnforge.core.ops.PoolMode;
import io.surfworks.dnnforge.core.ops.Sum;
import io.surfworks.dnnforge.core.tensor.ScalarType;
import io.surfworks.dnnforge.core.tensor.Tensor;

@DisplayName("DnnPooling")
class DnnPoolingTest {

    private static final DnnRuntime V5 = TestRuntimes.available(5005);

    private static Tensor random(Random rng, int... shape) {
        Tensor t = Tensor.zeros(ScalarType.F64, shape);
        Tensor.forEachIndex(shape, idx -> t.set(rng.nextDouble() * 2 - 1, idx));
        return t;
    }

    @Test
    @DisplayName("the output shape follows the descriptor geometry")
    void outputShape() {
        Value img = Value.input(TensorType.of(ScalarType.F32, 2, 3, 7, 6), "img");
        Value desc = new PoolingDescriptorBuilder(List.of(3, 2), List.of(2, 2), List.of(1, 0), PoolMode.MAX).call();

        Value out = new DnnPooling().call(img, desc);

        assertEquals(TensorType.of(ScalarType.F32, 2, 3, 4, 3), out.type());
    }

    @Test
    @DisplayName("unknown dimensions stay unknown")
    void unknownDims() {
        Value img = Value.input(TensorType.ofRank(ScalarType.F32, 4), "img");
        Value desc = new PoolingDescriptorBuilder(List.of(2, 2), List.of(2, 2), List.of(0, 0), PoolMode.MAX).call();

        Value out = new DnnPooling().call(img, desc);

        assertEquals(List.of(-1, -1, -1, -1), out.tensorType().shape());
    }

    @Test
    @DisplayName("rejects foreign descriptors and rank mismatches")
    void rejects() {
        Value img = Value.input(TensorType.of(ScalarType.F32, 1, 1, 4, 4), "img");
        Value volumeDesc = new PoolingDescriptorBuilder(List.of(2, 2, 2), List.of(1, 1, 1), List.of(0, 0, 0),
                PoolMode.MAX).call();

        assertThrows(ConfigurationException.class, () -> new DnnPooling().call(img, img));
        assertThrows(ShapeException.class, () -> new DnnPooling().call(img, volumeDesc));
        assertThrows(ConfigurationException.class,
                () -> new PoolingDescriptorBuilder(List.of(2), List.of(1), List.of(0), PoolMode.MAX));
        assertThrows(ConfigurationException.class,
                () -> new PoolingDescriptorBuilder(List.of(2, 2), List.of(1, 0), List.of(0, 0), PoolMode.MAX));
    }

    @Test
    @DisplayName("gradients match finite differences for every mode")
    void gradients() {
        Random rng = new Random(43);
        for (PoolMode mode : PoolMode.values()) {
            Value img = Value.input(TensorType.of(ScalarType.F64, 1, 2, 5, 4), "img");
            Value pooled = Dnn.pooling(V5, img, List.of(3, 2), List.of(2, 1), mode, List.of(1, 1));
            int[] outShape = pooled.tensorType().shape().stream().mapToInt(Integer::intValue).toArray();
            Value cost = Sum.all(Elemwise.mul(pooled, Constant.of(random(rng, outShape))));

            GradientVerifier.Result result = GradientVerifier.check(List.of(img), cost,
                    Map.of(img, random(rng, 1, 2, 5, 4)),
                    () -> V5.newExecutionContext(new ReferenceDnnKernels()), 1e-6);

            assertTrue(result.passes(1e-5), mode + ": " + result);
        }
    }

    @Test
    @DisplayName("the gradient is typed like the image and needs matching forward buffers")
    void gradientTypes() {
        Value img = Value.input(TensorType.of(ScalarType.F32, 1, 1, 4, 4), "img");
        Value out = Value.input(TensorType.of(ScalarType.F32, 1, 1, 2, 2), "out");
        Value matrix = Value.input(TensorType.of(ScalarType.F32, 2, 2), "m");
        Value desc = new PoolingDescriptorBuilder(List.of(2, 2), List.of(2, 2), List.of(0, 0), PoolMode.MAX).call();

        assertEquals(img.type(), new DnnPoolingGrad().call(img, out, out, desc).type());
        assertThrows(ShapeException.class, () -> new DnnPoolingGrad().call(img, out, matrix, desc));
    }
}
