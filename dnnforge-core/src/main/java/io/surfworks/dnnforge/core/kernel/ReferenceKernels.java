package io.surfworks.dnnforge.core.kernel;

import java.util.Arrays;

import io.surfworks.dnnforge.core.graph.ShapeException;
import io.surfworks.dnnforge.core.ops.PoolMode;
import io.surfworks.dnnforge.core.tensor.ScalarType;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * Straightforward CPU loops for convolution, pooling and softmax.
 *
 * <p>Layouts follow the accelerated library: images are
 * {@code [batch, channel, spatial...]} and filters are
 * {@code [out_channel, in_channel, spatial...]}. Any number of spatial axes is
 * accepted. Convolutions blend into their output as
 * {@code out = alpha * result + beta * out}; when {@code beta} is zero the old
 * output is not read.
 */
public final class ReferenceKernels {

    private ReferenceKernels() {
    }

    /**
     * Output size along one spatial axis: {@code floor((in + 2*pad - kernel) / stride) + 1}.
     */
    public static int outputSize(int input, int kernel, int pad, int stride) {
        return Math.floorDiv(input + 2 * pad - kernel, stride) + 1;
    }

    // ==================== Convolution ====================

    /**
     * {@code y = alpha * conv(x, w) + beta * y}, cross-correlation unless {@code flip}.
     */
    public static void convolutionForward(Tensor x, Tensor w, Tensor y, int[] pads, int[] strides,
                                          boolean flip, double alpha, double beta) {
        checkConvolutionShapes(x.shape(), w.shape(), y.shape(), pads, strides, "forward");
        int nd = x.rank() - 2;
        int[] xs = x.shape();
        int[] ws = w.shape();
        int[] taps = taps(xs[1], ws, nd);
        int[] xi = new int[nd + 2];
        int[] wi = new int[nd + 2];
        Tensor.forEachIndex(y.shape(), yi -> {
            double[] acc = {0};
            Tensor.forEachIndex(taps, t -> {
                for (int d = 0; d < nd; d++) {
                    int pos = yi[d + 2] * strides[d] - pads[d] + t[d + 1];
                    if (pos < 0 || pos >= xs[d + 2]) {
                        return;
                    }
                    xi[d + 2] = pos;
                    wi[d + 2] = flip ? ws[d + 2] - 1 - t[d + 1] : t[d + 1];
                }
                xi[0] = yi[0];
                xi[1] = t[0];
                wi[0] = yi[1];
                wi[1] = t[0];
                acc[0] += x.get(xi) * w.get(wi);
            });
            y.set(blend(alpha, acc[0], beta, y, yi), yi);
        });
    }

    /**
     * Gradient of the forward convolution with respect to its image:
     * {@code dx = alpha * conv_T(dy, w) + beta * dx}.
     */
    public static void convolutionBackwardData(Tensor w, Tensor dy, Tensor dx, int[] pads, int[] strides,
                                               boolean flip, double alpha, double beta) {
        checkConvolutionShapes(dx.shape(), w.shape(), dy.shape(), pads, strides, "backward data");
        int nd = dx.rank() - 2;
        int[] xs = dx.shape();
        int[] ws = w.shape();
        int[] taps = taps(xs[1], ws, nd);
        Tensor acc = Tensor.zeros(ScalarType.F64, xs);
        int[] xi = new int[nd + 2];
        int[] wi = new int[nd + 2];
        Tensor.forEachIndex(dy.shape(), yi -> {
            double g = dy.get(yi);
            if (g == 0) {
                return;
            }
            Tensor.forEachIndex(taps, t -> {
                for (int d = 0; d < nd; d++) {
                    int pos = yi[d + 2] * strides[d] - pads[d] + t[d + 1];
                    if (pos < 0 || pos >= xs[d + 2]) {
                        return;
                    }
                    xi[d + 2] = pos;
                    wi[d + 2] = flip ? ws[d + 2] - 1 - t[d + 1] : t[d + 1];
                }
                xi[0] = yi[0];
                xi[1] = t[0];
                wi[0] = yi[1];
                wi[1] = t[0];
                acc.accumulate(g * w.get(wi), xi);
            });
        });
        Tensor.forEachIndex(xs, i -> dx.set(blend(alpha, acc.get(i), beta, dx, i), i));
    }

    /**
     * Gradient of the forward convolution with respect to its filters:
     * {@code dw = alpha * corr(x, dy) + beta * dw}.
     */
    public static void convolutionBackwardFilter(Tensor x, Tensor dy, Tensor dw, int[] pads, int[] strides,
                                                 boolean flip, double alpha, double beta) {
        checkConvolutionShapes(x.shape(), dw.shape(), dy.shape(), pads, strides, "backward filter");
        int nd = x.rank() - 2;
        int[] xs = x.shape();
        int[] ws = dw.shape();
        int[] taps = taps(xs[1], ws, nd);
        Tensor acc = Tensor.zeros(ScalarType.F64, ws);
        int[] xi = new int[nd + 2];
        int[] wi = new int[nd + 2];
        Tensor.forEachIndex(dy.shape(), yi -> {
            double g = dy.get(yi);
            if (g == 0) {
                return;
            }
            Tensor.forEachIndex(taps, t -> {
                for (int d = 0; d < nd; d++) {
                    int pos = yi[d + 2] * strides[d] - pads[d] + t[d + 1];
                    if (pos < 0 || pos >= xs[d + 2]) {
                        return;
                    }
                    xi[d + 2] = pos;
                    wi[d + 2] = flip ? ws[d + 2] - 1 - t[d + 1] : t[d + 1];
                }
                xi[0] = yi[0];
                xi[1] = t[0];
                wi[0] = yi[1];
                wi[1] = t[0];
                acc.accumulate(g * x.get(xi), wi);
            });
        });
        Tensor.forEachIndex(ws, i -> dw.set(blend(alpha, acc.get(i), beta, dw, i), i));
    }

    private static int[] taps(int channels, int[] filterShape, int nd) {
        int[] taps = new int[nd + 1];
        taps[0] = channels;
        for (int d = 0; d < nd; d++) {
            taps[d + 1] = filterShape[d + 2];
        }
        return taps;
    }

    private static double blend(double alpha, double value, double beta, Tensor out, int[] idx) {
        if (beta == 0) {
            return alpha * value;
        }
        return alpha * value + beta * out.get(idx);
    }

    private static void checkConvolutionShapes(int[] image, int[] filter, int[] output, int[] pads, int[] strides,
                                               String direction) {
        int rank = image.length;
        if (filter.length != rank || output.length != rank || rank < 3) {
            throw new ShapeException("Convolution " + direction + ": rank mismatch, image "
                    + Arrays.toString(image) + ", filter " + Arrays.toString(filter)
                    + ", output " + Arrays.toString(output));
        }
        if (pads.length != rank - 2 || strides.length != rank - 2) {
            throw new ShapeException("Convolution " + direction + ": expected " + (rank - 2)
                    + " pads and strides, got " + Arrays.toString(pads) + " and " + Arrays.toString(strides));
        }
        boolean ok = image[1] == filter[1] && output[0] == image[0] && output[1] == filter[0];
        for (int d = 0; ok && d < rank - 2; d++) {
            ok = output[d + 2] == outputSize(image[d + 2], filter[d + 2], pads[d], strides[d]);
        }
        if (!ok) {
            throw new ShapeException("Convolution " + direction + ": image " + Arrays.toString(image)
                    + " and filter " + Arrays.toString(filter) + " with pads " + Arrays.toString(pads)
                    + " and strides " + Arrays.toString(strides) + " do not produce output "
                    + Arrays.toString(output));
        }
    }

    // ==================== Pooling ====================

    /**
     * Pools {@code x} into a new tensor of {@code outputShape}. Window positions
     * outside the image are skipped for max and exclusive averaging and count as
     * zeros for inclusive averaging.
     */
    public static Tensor poolingForward(Tensor x, int[] outputShape, int[] window, int[] strides, int[] pads,
                                        PoolMode mode) {
        int nd = window.length;
        int[] xs = x.shape();
        checkPoolingShapes(xs, outputShape, nd);
        Tensor y = Tensor.zeros(x.dtype(), outputShape);
        int windowSize = product(window);
        int[] xi = new int[nd + 2];
        Tensor.forEachIndex(outputShape, yi -> {
            double[] state = {Double.NEGATIVE_INFINITY, 0, 0};
            xi[0] = yi[0];
            xi[1] = yi[1];
            Tensor.forEachIndex(window, r -> {
                for (int d = 0; d < nd; d++) {
                    int pos = yi[d + 2] * strides[d] - pads[d] + r[d];
                    if (pos < 0 || pos >= xs[d + 2]) {
                        return;
                    }
                    xi[d + 2] = pos;
                }
                double v = x.get(xi);
                state[0] = Math.max(state[0], v);
                state[1] += v;
                state[2]++;
            });
            double result = switch (mode) {
                case MAX -> state[2] == 0 ? 0 : state[0];
                case AVERAGE_INC_PAD -> state[1] / windowSize;
                case AVERAGE_EXC_PAD -> state[2] == 0 ? 0 : state[1] / state[2];
            };
            y.set(result, yi);
        });
        return y;
    }

    /**
     * Gradient of {@link #poolingForward} with respect to {@code x}. Max pooling
     * routes each output gradient to the first maximal input of its window.
     */
    public static Tensor poolingBackward(Tensor x, Tensor dy, int[] window, int[] strides, int[] pads,
                                         PoolMode mode) {
        int nd = window.length;
        int[] xs = x.shape();
        checkPoolingShapes(xs, dy.shape(), nd);
        Tensor dx = Tensor.zeros(x.dtype(), xs);
        int windowSize = product(window);
        int[] xi = new int[nd + 2];
        int[] best = new int[nd + 2];
        Tensor.forEachIndex(dy.shape(), yi -> {
            double g = dy.get(yi);
            double[] state = {Double.NEGATIVE_INFINITY, 0};
            boolean[] found = {false};
            xi[0] = yi[0];
            xi[1] = yi[1];
            Tensor.forEachIndex(window, r -> {
                for (int d = 0; d < nd; d++) {
                    int pos = yi[d + 2] * strides[d] - pads[d] + r[d];
                    if (pos < 0 || pos >= xs[d + 2]) {
                        return;
                    }
                    xi[d + 2] = pos;
                }
                state[1]++;
                double v = x.get(xi);
                if (!found[0] || v > state[0]) {
                    state[0] = v;
                    found[0] = true;
                    System.arraycopy(xi, 0, best, 0, xi.length);
                }
            });
            if (mode == PoolMode.MAX) {
                if (found[0]) {
                    dx.accumulate(g, best);
                }
                return;
            }
            double share = mode == PoolMode.AVERAGE_INC_PAD ? g / windowSize : g / state[1];
            Tensor.forEachIndex(window, r -> {
                for (int d = 0; d < nd; d++) {
                    int pos = yi[d + 2] * strides[d] - pads[d] + r[d];
                    if (pos < 0 || pos >= xs[d + 2]) {
                        return;
                    }
                    xi[d + 2] = pos;
                }
                dx.accumulate(share, xi);
            });
        });
        return dx;
    }

    private static void checkPoolingShapes(int[] image, int[] output, int nd) {
        if (image.length != nd + 2 || output.length != nd + 2
                || image[0] != output[0] || image[1] != output[1]) {
            throw new ShapeException("Pooling over " + nd + " spatial axes: image " + Arrays.toString(image)
                    + " does not match output " + Arrays.toString(output));
        }
    }

    private static int product(int[] values) {
        int p = 1;
        for (int v : values) {
            p *= v;
        }
        return p;
    }

    // ==================== Softmax ====================

    /**
     * Axes normalized over: always axis 1, plus every later axis when
     * normalizing per instance.
     */
    public static boolean[] softmaxAxes(int rank, boolean perInstance) {
        boolean[] reduced = new boolean[rank];
        for (int axis = 1; axis < rank; axis++) {
            reduced[axis] = axis == 1 || perInstance;
        }
        return reduced;
    }

    /**
     * Softmax (or log-softmax) of {@code x} over the {@code reduced} axes.
     *
     * @param subtractMax subtract the group maximum first for numerical stability
     */
    public static Tensor softmaxForward(Tensor x, boolean[] reduced, boolean log, boolean subtractMax) {
        int[] shape = x.shape();
        long[] groupStrides = new long[shape.length];
        int groups = groupStrides(shape, reduced, groupStrides);
        double[] max = new double[groups];
        Arrays.fill(max, subtractMax ? Double.NEGATIVE_INFINITY : 0);
        double[] sum = new double[groups];
        if (subtractMax) {
            Tensor.forEachIndex(shape, i -> {
                int g = group(i, groupStrides);
                max[g] = Math.max(max[g], x.get(i));
            });
        }
        Tensor.forEachIndex(shape, i -> {
            int g = group(i, groupStrides);
            sum[g] += Math.exp(x.get(i) - max[g]);
        });
        Tensor y = Tensor.zeros(x.dtype(), shape);
        Tensor.forEachIndex(shape, i -> {
            int g = group(i, groupStrides);
            double shifted = x.get(i) - max[g];
            y.set(log ? shifted - Math.log(sum[g]) : Math.exp(shifted) / sum[g], i);
        });
        return y;
    }

    /**
     * Gradient of {@link #softmaxForward} given the forward output {@code sm}.
     */
    public static Tensor softmaxBackward(Tensor dy, Tensor sm, boolean[] reduced, boolean log) {
        int[] shape = sm.shape();
        if (!Arrays.equals(shape, dy.shape())) {
            throw new ShapeException("Softmax gradient: output gradient " + Arrays.toString(dy.shape())
                    + " does not match forward output " + Arrays.toString(shape));
        }
        long[] groupStrides = new long[shape.length];
        int groups = groupStrides(shape, reduced, groupStrides);
        double[] dot = new double[groups];
        Tensor.forEachIndex(shape, i -> {
            int g = group(i, groupStrides);
            dot[g] += log ? dy.get(i) : dy.get(i) * sm.get(i);
        });
        Tensor dx = Tensor.zeros(sm.dtype(), shape);
        Tensor.forEachIndex(shape, i -> {
            int g = group(i, groupStrides);
            double value = log
                    ? dy.get(i) - Math.exp(sm.get(i)) * dot[g]
                    : sm.get(i) * (dy.get(i) - dot[g]);
            dx.set(value, i);
        });
        return dx;
    }

    private static int groupStrides(int[] shape, boolean[] reduced, long[] out) {
        int groups = 1;
        for (int axis = shape.length - 1; axis >= 0; axis--) {
            if (reduced[axis]) {
                out[axis] = 0;
            } else {
                out[axis] = groups;
                groups *= shape[axis];
            }
        }
        return groups;
    }

    private static int group(int[] idx, long[] groupStrides) {
        long g = 0;
        for (int axis = 0; axis < idx.length; axis++) {
            g += idx[axis] * groupStrides[axis];
        }
        return (int) g;
    }
}
