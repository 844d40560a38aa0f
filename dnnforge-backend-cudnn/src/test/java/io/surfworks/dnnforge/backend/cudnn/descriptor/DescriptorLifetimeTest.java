package io.surfworks.dnnforge.backend.cudnn.descriptor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.dnnforge.backend.cudnn.Dnn;
import io.surfworks.dnnforge.backend.cudnn.DnnRuntime;
import io.surfworks.dnnforge.backend.cudnn.FeatureUnsupportedException;
import io.surfworks.dnnforge.backend.cudnn.TestRuntimes;
import io.surfworks.dnnforge.backend.cudnn.kernel.ConvolutionGeometry;
import io.surfworks.dnnforge.backend.cudnn.kernel.ReferenceDnnKernels;
import io.surfworks.dnnforge.backend.cudnn.ops.ConvMode;
import io.surfworks.dnnforge.core.exec.ExecutionContext;
import io.surfworks.dnnforge.core.exec.GraphInterpreter;
import io.surfworks.dnnforge.core.graph.ConfigurationException;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.graph.ShapeException;
import io.surfworks.dnnforge.core.graph.TensorType;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.ops.BorderMode;
import io.surfworks.dnnforge.core.ops.PoolMode;
import io.surfworks.dnnforge.core.tensor.ScalarType;
import io.surfworks.dnnforge.core.tensor.Tensor;

@DisplayName("Descriptors")
class DescriptorLifetimeTest {

    private static final DnnRuntime V5 = TestRuntimes.available(5005);
    private static final DnnRuntime V2 = TestRuntimes.available(2000);

    @Nested
    @DisplayName("Lifetime")
    class Lifetime {

        private final Value img = Value.input(TensorType.of(ScalarType.F32, 1, 2, 6, 6), "img");
        private final Value kerns = Value.input(TensorType.of(ScalarType.F32, 3, 2, 3, 3), "kerns");
        private final Map<Value, Tensor> values = Map.of(
                img, Tensor.full(ScalarType.F32, 1, 1, 2, 6, 6),
                kerns, Tensor.full(ScalarType.F32, 0.5, 3, 2, 3, 3));

        @Test
        @DisplayName("equal descriptors in one context are created once and released once on close")
        void sharedAndReleased() {
            Value a = Dnn.convolution(V5, img, kerns);
            Value b = Dnn.convolution(V5, img, kerns);
            Value pooled = Dnn.pooling(V5, a, List.of(2, 2), List.of(2, 2), PoolMode.MAX, null);
            OperationGraph graph = OperationGraph.of(List.of(img, kerns), List.of(pooled, b));
            ReferenceDnnKernels kernels = new ReferenceDnnKernels();

            try (ExecutionContext context = V5.newExecutionContext(kernels)) {
                GraphInterpreter.evaluate(graph, values, context);
                GraphInterpreter.evaluate(graph, values, context);

                assertEquals(2, kernels.createdDescriptors());
                assertEquals(2, kernels.liveDescriptors());
                assertEquals(2, context.resourceCount());
            }

            assertEquals(0, kernels.liveDescriptors());
            assertEquals(kernels.createdDescriptors(), kernels.destroyedDescriptors());
        }

        @Test
        @DisplayName("each context materializes its own descriptors")
        void perContext() {
            Value conv = Dnn.convolution(V5, img, kerns);
            OperationGraph graph = OperationGraph.of(List.of(img, kerns), List.of(conv));
            ReferenceDnnKernels kernels = new ReferenceDnnKernels();

            for (int i = 0; i < 3; i++) {
                try (ExecutionContext context = V5.newExecutionContext(kernels)) {
                    GraphInterpreter.evaluate(graph, values, context);
                }
            }

            assertEquals(3, kernels.createdDescriptors());
            assertEquals(3, kernels.destroyedDescriptors());
            assertEquals(0, kernels.liveDescriptors());
        }

        @Test
        @DisplayName("a closed context refuses to hand out descriptors")
        void closedContext() {
            Value conv = Dnn.convolution(V5, img, kerns);
            OperationGraph graph = OperationGraph.of(List.of(img, kerns), List.of(conv));
            ExecutionContext context = V5.newExecutionContext(new ReferenceDnnKernels());
            context.close();
            context.close();

            assertThrows(IllegalStateException.class, () -> GraphInterpreter.evaluate(graph, values, context));
        }
    }

    @Nested
    @DisplayName("Convolution descriptor")
    class Convolution {

        @Test
        @DisplayName("full padding resolves against the kernel shape")
        void fullPadding() {
            ConvolutionDescriptorBuilder builder = new ConvolutionDescriptorBuilder(BorderMode.FULL, List.of(1, 2),
                    ConvMode.CROSS_CORRELATION);

            ConvolutionGeometry geometry = builder.geometry(new long[] {4, 3, 5, 3});

            assertEquals(List.of(4, 2), geometry.pads());
            assertEquals(List.of(1, 2), geometry.strides());
            assertEquals(ConvMode.CROSS_CORRELATION, geometry.mode());
        }

        @Test
        @DisplayName("a uniform pad expands to every spatial axis")
        void uniformPad() {
            ConvolutionDescriptorBuilder builder = new ConvolutionDescriptorBuilder(BorderMode.uniform(2),
                    List.of(1, 1, 1), ConvMode.CONVOLUTION);

            assertEquals(List.of(2, 2, 2), builder.geometry(new long[] {1, 1, 3, 3, 3}).pads());
        }

        @Test
        @DisplayName("rejects bad strides, mismatched pads and wrong kernel shapes")
        void rejects() {
            assertThrows(ConfigurationException.class,
                    () -> new ConvolutionDescriptorBuilder(BorderMode.VALID, List.of(1), ConvMode.CONVOLUTION));
            assertThrows(ConfigurationException.class,
                    () -> new ConvolutionDescriptorBuilder(BorderMode.VALID, List.of(1, 0), ConvMode.CONVOLUTION));
            assertThrows(ConfigurationException.class,
                    () -> new ConvolutionDescriptorBuilder(BorderMode.explicit(1, 1, 1), List.of(1, 1),
                            ConvMode.CONVOLUTION));

            ConvolutionDescriptorBuilder planar = new ConvolutionDescriptorBuilder(BorderMode.VALID, List.of(1, 1),
                    ConvMode.CONVOLUTION);
            Value volumeShape = Value.input(TensorType.of(ScalarType.I64, 5), "shape");
            Value floatShape = Value.input(TensorType.of(ScalarType.F32, 4), "shape");
            assertThrows(ShapeException.class, () -> planar.call(volumeShape));
            assertThrows(ShapeException.class, () -> planar.call(floatShape));
            assertThrows(ShapeException.class, () -> planar.geometry(new long[] {1, 1, 3}));
        }

        @Test
        @DisplayName("3-D descriptors need a v3 backend")
        void volumetric() {
            assertThrows(FeatureUnsupportedException.class, () -> ConvolutionDescriptorBuilder.create(V2,
                    BorderMode.VALID, List.of(1, 1, 1), ConvMode.CONVOLUTION));
            assertEquals(3, ConvolutionDescriptorBuilder.create(V5, BorderMode.VALID, List.of(1, 1, 1),
                    ConvMode.CONVOLUTION).spatialRank());
        }
    }

    @Nested
    @DisplayName("Pooling descriptor")
    class Pooling {

        @Test
        @DisplayName("3-D descriptors need a v3 backend")
        void volumetric() {
            assertThrows(FeatureUnsupportedException.class, () -> PoolingDescriptorBuilder.create(V2,
                    List.of(2, 2, 2), List.of(1, 1, 1), List.of(0, 0, 0), PoolMode.MAX));
        }

        @Test
        @DisplayName("window, stride and pad must agree in length and sign")
        void rejects() {
            assertThrows(ConfigurationException.class, () -> new PoolingDescriptorBuilder(List.of(2, 2),
                    List.of(1), List.of(0, 0), PoolMode.MAX));
            assertThrows(ConfigurationException.class, () -> new PoolingDescriptorBuilder(List.of(2, 2),
                    List.of(1, 1), List.of(0, -1), PoolMode.MAX));
            assertThrows(ConfigurationException.class, () -> new PoolingDescriptorBuilder(List.of(0, 2),
                    List.of(1, 1), List.of(0, 0), PoolMode.MAX));
        }
    }
}
