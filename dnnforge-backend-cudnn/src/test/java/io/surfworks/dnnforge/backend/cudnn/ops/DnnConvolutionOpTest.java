package io.surfworks.dnnforge.backend.cudnn.ops;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.dnnforge.backend.cudnn.Dnn;
import io.surfworks.dnnforge.backend.cudnn.DnnRuntime;
import io.surfworks.dnnforge.backend.cudnn.TestRuntimes;
import io.surfworks.dnnforge.backend.cudnn.descriptor.ConvolutionDescriptorBuilder;
import io.surfworks.dnnforge.backend.cudnn.kernel.ReferenceDnnKernels;
import io.surfworks.dnnforge.core.exec.ExecutionContext;
import io.surfworks.dnnforge.core.exec.GraphInterpreter;
import io.surfworks.dnnforge.core.grad.GradientNotImplementedException;
import io.surfworks.dnnforge.core.grad.GradientVerifier;
import io.surfworks.dnnforge.core.grad.Gradients;
import io.surfworks.dnnforge.core.graph.ConfigurationException;
import io.surfworks.dnnforge.core.graph.Constant;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.graph.ShapeException;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.ops.BorderMode;
import io.surfworks.dnnforge.core.ops.Conv;
import io.surfworks.dnnforge.core.ops.DirectionHint;
import io.surfworks.dnnforge.core.ops.Elemwise;
import io.surfworks.dnnforge.core.ops.Shapes;
import io.surfworks.dnnforge.core.ops.Sum;
import io.surfworks.dnnforge.core.tensor.ScalarType;
import io.surfworks.dnnforge.core.tensor.Tensor;

@DisplayName("DnnConvolutionOp")
class DnnConvolutionOpTest {

    private static final DnnRuntime V5 = TestRuntimes.available(5005);

    private static Tensor random(Random rng, int... shape) {
        Tensor t = Tensor.zeros(ScalarType.F64, shape);
        Tensor.forEachIndex(shape, idx -> t.set(rng.nextDouble() * 2 - 1, idx));
        return t;
    }

    private static Value descriptor(Value kerns, int nd) {
        List<Integer> unit = nd == 2 ? List.of(1, 1) : List.of(1, 1, 1);
        return ConvolutionDescriptorBuilder.create(V5, BorderMode.VALID, unit, ConvMode.CONVOLUTION)
                .call(Shapes.shapeOf(kerns));
    }

    @Nested
    @DisplayName("Types")
    class Types {

        private final Value img = Value.input(TensorType.of(ScalarType.F32, 2, 3, 8, 8), "img");
        private final Value kerns = Value.input(TensorType.of(ScalarType.F32, 4, 3, 3, 3), "kerns");
        private final Value out = Value.input(TensorType.of(ScalarType.F32, 2, 4, 6, 6), "out");
        private final Value one = Constant.scalar(ScalarType.F32, 1);
        private final Value zero = Constant.scalar(ScalarType.F32, 0);

        @Test
        @DisplayName("the result is typed like the output buffer")
        void outputType() {
            Value result = new DnnConvolution(ForwardAlgorithm.SMALL)
                    .call(img, kerns, out, descriptor(kerns, 2), one, zero);

            assertEquals(out.type(), result.type());
        }

        @Test
        @DisplayName("rejects rank, dtype, descriptor and scale mismatches")
        void rejects() {
            DnnConvolution op = new DnnConvolution(ForwardAlgorithm.SMALL);
            Value desc = descriptor(kerns, 2);
            Value matrix = Value.input(TensorType.of(ScalarType.F32, 2, 4), "m");
            Value doubles = Value.input(TensorType.of(ScalarType.F64, 2, 4, 6, 6), "d");
            Value vectorScale = Value.input(TensorType.of(ScalarType.F32, 1), "s");

            assertThrows(ShapeException.class, () -> op.call(img, kerns, matrix, desc, one, zero));
            assertThrows(ShapeException.class, () -> op.call(img, kerns, doubles, desc, one, zero));
            assertThrows(ShapeException.class, () -> op.call(img, kerns, out, img, one, zero));
            assertThrows(ShapeException.class, () -> op.call(img, kerns, out, desc, vectorScale, zero));
            assertThrows(ShapeException.class, () -> op.call(img, kerns, out, desc, one));
        }

        @Test
        @DisplayName("FFT forward and deterministic backward kernels are 2-D only")
        void spatialRank() {
            Value volume = Value.input(TensorType.of(ScalarType.F32, 1, 1, 4, 4, 4), "v");
            Value volumeKerns = Value.input(TensorType.of(ScalarType.F32, 1, 1, 2, 2, 2), "k");
            Value volumeOut = Value.input(TensorType.of(ScalarType.F32, 1, 1, 3, 3, 3), "o");
            Value desc = descriptor(volumeKerns, 3);

            assertThrows(ConfigurationException.class, () -> new DnnConvolution(ForwardAlgorithm.FFT)
                    .call(volume, volumeKerns, volumeOut, desc, one, zero));
            assertThrows(ConfigurationException.class,
                    () -> new DnnConvolutionGradWeights(BackwardAlgorithm.DETERMINISTIC)
                            .call(volume, volumeOut, volumeKerns, desc, one, zero));
        }

        @Test
        @DisplayName("only in-place operators destroy their output buffer")
        void destroyMap() {
            assertEquals(Map.of(), new DnnConvolution(ForwardAlgorithm.SMALL).destroyMap());
            assertEquals(Map.of(0, DnnConvolutionOp.OUTPUT),
                    new DnnConvolutionGradInputs(BackwardAlgorithm.NONE, true).destroyMap());
            assertEquals(new DnnConvolutionGradWeights(BackwardAlgorithm.NONE, true),
                    new DnnConvolutionGradWeights(BackwardAlgorithm.NONE).withInplace(true));
        }
    }

    @Nested
    @DisplayName("Execution")
    class Execution {

        @Test
        @DisplayName("computes alpha * conv + beta * out without touching out")
        void alphaBeta() {
            Random rng = new Random(41);
            Value img = Value.input(TensorType.of(ScalarType.F64, 1, 2, 5, 5), "img");
            Value kerns = Value.input(TensorType.of(ScalarType.F64, 3, 2, 3, 3), "kerns");
            Value out = Value.input(TensorType.of(ScalarType.F64, 1, 3, 3, 3), "out");
            Tensor imgValue = random(rng, 1, 2, 5, 5);
            Tensor kernsValue = random(rng, 3, 2, 3, 3);
            Tensor outValue = random(rng, 1, 3, 3, 3);
            Tensor outBefore = outValue.copy();

            Value result = new DnnConvolution(ForwardAlgorithm.SMALL).call(img, kerns, out, descriptor(kerns, 2),
                    Constant.scalar(ScalarType.F64, 2), Constant.scalar(ScalarType.F64, 0.5));
            Tensor actual;
            try (ExecutionContext context = V5.newExecutionContext(new ReferenceDnnKernels())) {
                actual = GraphInterpreter.evaluateTensor(OperationGraph.of(List.of(img, kerns, out), List.of(result)),
                        Map.of(img, imgValue, kerns, kernsValue, out, outValue), context);
            }
            Tensor conv;
            try (ExecutionContext context = new ExecutionContext()) {
                Value generic = new Conv(BorderMode.VALID, List.of(1, 1)).call(img, kerns);
                conv = GraphInterpreter.evaluateTensor(OperationGraph.of(List.of(img, kerns), List.of(generic)),
                        Map.of(img, imgValue, kerns, kernsValue), context);
            }

            double[] expected = conv.toArray();
            double[] previous = outBefore.toArray();
            for (int i = 0; i < expected.length; i++) {
                expected[i] = 2 * expected[i] + 0.5 * previous[i];
            }
            assertArrayEquals(expected, actual.toArray(), 1e-12);
            assertArrayEquals(previous, outValue.toArray());
        }
    }

    @Nested
    @DisplayName("Gradients")
    class GradientChecks {

        private void check(int[] imgShape, int[] kernShape, BorderMode border, List<Integer> subsample,
                           DirectionHint hint, long seed) {
            Random rng = new Random(seed);
            Value img = Value.input(TensorType.of(ScalarType.F64, imgShape), "img");
            Value kerns = Value.input(TensorType.of(ScalarType.F64, kernShape), "kerns");
            Value conv = Dnn.convolution(V5, img, kerns, border, subsample, ConvMode.CONVOLUTION, hint, null);
            int[] outShape = conv.tensorType().shape().stream().mapToInt(Integer::intValue).toArray();
            Value cost = Sum.all(Elemwise.mul(conv, Constant.of(random(rng, outShape))));

            GradientVerifier.Result result = GradientVerifier.check(List.of(img, kerns), cost,
                    Map.of(img, random(rng, imgShape), kerns, random(rng, kernShape)),
                    () -> V5.newExecutionContext(new ReferenceDnnKernels()), 1e-6);

            assertTrue(result.passes(1e-6), border + " " + subsample + " " + hint + ": " + result);
        }

        @Test
        @DisplayName("2-D: forward, weight-gradient adjoint and input-gradient adjoint")
        void planar() {
            int[] img = {2, 2, 5, 4};
            int[] kerns = {3, 2, 3, 2};
            check(img, kerns, BorderMode.VALID, List.of(1, 1), DirectionHint.NONE, 1);
            check(img, kerns, BorderMode.VALID, List.of(1, 1), DirectionHint.BPROP_WEIGHTS, 2);
            check(img, kerns, BorderMode.FULL, List.of(1, 1), DirectionHint.NONE, 3);
            check(img, kerns, BorderMode.explicit(1, 0), List.of(2, 1), DirectionHint.NONE, 4);
        }

        @Test
        @DisplayName("3-D: forward, weight-gradient adjoint and input-gradient adjoint")
        void volumetric() {
            int[] img = {1, 2, 3, 4, 3};
            int[] kerns = {2, 2, 2, 2, 2};
            check(img, kerns, BorderMode.VALID, List.of(1, 1, 1), DirectionHint.NONE, 5);
            check(img, kerns, BorderMode.VALID, List.of(1, 1, 1), DirectionHint.BPROP_WEIGHTS, 6);
            check(img, kerns, BorderMode.FULL, List.of(1, 1, 1), DirectionHint.NONE, 7);
            check(img, kerns, BorderMode.uniform(1), List.of(1, 2, 1), DirectionHint.NONE, 8);
        }

        @Test
        @DisplayName("the scales have no gradient")
        void scales() {
            Value img = Value.input(TensorType.of(ScalarType.F64, 1, 1, 4, 4), "img");
            Value kerns = Value.input(TensorType.of(ScalarType.F64, 1, 1, 2, 2), "kerns");
            Value alpha = Value.input(TensorType.scalar(ScalarType.F64), "alpha");
            Value conv = new DnnConvolution(ForwardAlgorithm.SMALL).call(img, kerns,
                    Shapes.alloc(ScalarType.F64, List.of(Shapes.constant(1), Shapes.constant(1),
                            Shapes.constant(3), Shapes.constant(3))),
                    descriptor(kerns, 2), alpha, Constant.scalar(ScalarType.F64, 0));
            Value cost = Sum.all(conv);

            assertThrows(GradientNotImplementedException.class, () -> Gradients.grad(cost, List.of(alpha)));
            assertEquals(1, Gradients.grad(cost, List.of(img)).size());
        }
    }
}
