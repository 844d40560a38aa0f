package io.surfworks.dnnforge.core.tensor;

import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

/**
 * A host-side multi-dimensional tensor backed by a double array.
 *
 * <p>Values are held as doubles regardless of dtype; writes are rounded through
 * {@link ScalarType#coerce(double)}. Views produced by {@link #permute},
 * {@link #flip} and {@link #dimShuffle} share storage with their source and are
 * generally not contiguous.
 */
public final class Tensor {
    private final TensorSpec spec;
    private final double[] data;

    private Tensor(TensorSpec spec, double[] data) {
        this.spec = spec;
        this.data = data;
    }

    // ==================== Factory Methods ====================

    /**
     * Create a zero-initialized tensor with the given dtype and shape.
     */
    public static Tensor zeros(ScalarType dtype, int... shape) {
        TensorSpec spec = TensorSpec.of(dtype, shape);
        return new Tensor(spec, new double[(int) spec.elementCount()]);
    }

    /**
     * Create a tensor filled with a constant value.
     */
    public static Tensor full(ScalarType dtype, double value, int... shape) {
        Tensor tensor = zeros(dtype, shape);
        Arrays.fill(tensor.data, dtype.coerce(value));
        return tensor;
    }

    /**
     * Create a tensor from a flat row-major array.
     */
    public static Tensor of(ScalarType dtype, double[] values, int... shape) {
        TensorSpec spec = TensorSpec.of(dtype, shape);
        if (values.length != spec.elementCount()) {
            throw new IllegalArgumentException(
                "Data length " + values.length + " doesn't match shape " + Arrays.toString(shape) +
                " (expected " + spec.elementCount() + " elements)");
        }
        double[] copy = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            copy[i] = dtype.coerce(values[i]);
        }
        return new Tensor(spec, copy);
    }

    /**
     * Create a rank-0 tensor.
     */
    public static Tensor scalar(ScalarType dtype, double value) {
        return of(dtype, new double[] {value});
    }

    /**
     * Create a rank-1 int64 tensor, the representation of a shape vector.
     */
    public static Tensor vector(long... values) {
        double[] d = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            d[i] = values[i];
        }
        return of(ScalarType.I64, d, values.length);
    }

    // ==================== Accessors ====================

    public TensorSpec spec() {
        return spec;
    }

    public int[] shape() {
        return spec.shape().clone();
    }

    public int dim(int axis) {
        return spec.shape()[axis];
    }

    public int rank() {
        return spec.rank();
    }

    public ScalarType dtype() {
        return spec.dtype();
    }

    public long elementCount() {
        return spec.elementCount();
    }

    public boolean isContiguous() {
        return spec.isContiguous();
    }

    public double get(int... indices) {
        return data[(int) spec.storageIndex(indices)];
    }

    public void set(double value, int... indices) {
        data[(int) spec.storageIndex(indices)] = spec.dtype().coerce(value);
    }

    /**
     * Adds to the element at the given index.
     */
    public void accumulate(double delta, int... indices) {
        int idx = (int) spec.storageIndex(indices);
        data[idx] = spec.dtype().coerce(data[idx] + delta);
    }

    /**
     * Returns the single element of a rank-0 (or one-element) tensor.
     */
    public double scalarValue() {
        if (elementCount() != 1) {
            throw new IllegalStateException("Not a scalar: shape " + Arrays.toString(spec.shape()));
        }
        return toArray()[0];
    }

    /**
     * Returns the elements in logical row-major order.
     */
    public double[] toArray() {
        double[] out = new double[(int) elementCount()];
        if (spec.isContiguous()) {
            System.arraycopy(data, 0, out, 0, out.length);
            return out;
        }
        int[] pos = {0};
        forEachIndex(spec.shape(), idx -> out[pos[0]++] = get(idx));
        return out;
    }

    /**
     * Returns the elements as longs, for shape vectors.
     */
    public long[] toLongArray() {
        double[] values = toArray();
        long[] out = new long[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (long) values[i];
        }
        return out;
    }

    // ==================== Copies and Views ====================

    /**
     * Returns a contiguous copy with its own storage.
     */
    public Tensor copy() {
        return of(dtype(), toArray(), spec.shape());
    }

    /**
     * Returns this tensor if already contiguous, otherwise a contiguous copy.
     */
    public Tensor contiguous() {
        return isContiguous() ? this : copy();
    }

    /**
     * Returns a copy converted to another element type.
     */
    public Tensor cast(ScalarType target) {
        return of(target, toArray(), spec.shape());
    }

    /**
     * Returns a view with axes reordered: output axis i is input axis {@code axes[i]}.
     */
    public Tensor permute(int... axes) {
        if (axes.length != rank()) {
            throw new IllegalArgumentException("Permutation " + Arrays.toString(axes) + " has wrong rank");
        }
        int[] shape = new int[axes.length];
        long[] strides = new long[axes.length];
        boolean[] seen = new boolean[axes.length];
        for (int i = 0; i < axes.length; i++) {
            if (axes[i] < 0 || axes[i] >= rank() || seen[axes[i]]) {
                throw new IllegalArgumentException("Invalid permutation " + Arrays.toString(axes));
            }
            seen[axes[i]] = true;
            shape[i] = spec.shape()[axes[i]];
            strides[i] = spec.strides()[axes[i]];
        }
        return new Tensor(TensorSpec.withStrides(dtype(), shape, strides, spec.offset()), data);
    }

    /**
     * Returns a view with the given axes reversed.
     */
    public Tensor flip(int... axes) {
        int[] shape = spec.shape();
        long[] strides = spec.strides().clone();
        long offset = spec.offset();
        for (int axis : axes) {
            if (shape[axis] > 0) {
                offset += (long) (shape[axis] - 1) * strides[axis];
            }
            strides[axis] = -strides[axis];
        }
        return new Tensor(TensorSpec.withStrides(dtype(), shape, strides, offset), data);
    }

    /**
     * Returns a view following a dimshuffle pattern: each entry is a source axis,
     * or {@code -1} to insert a new axis of size 1. Source axes left out of the
     * pattern must have size 1.
     */
    public Tensor dimShuffle(List<Integer> pattern) {
        int[] srcShape = spec.shape();
        boolean[] used = new boolean[srcShape.length];
        int[] shape = new int[pattern.size()];
        long[] strides = new long[pattern.size()];
        for (int i = 0; i < pattern.size(); i++) {
            int src = pattern.get(i);
            if (src < 0) {
                shape[i] = 1;
                strides[i] = 0;
            } else {
                used[src] = true;
                shape[i] = srcShape[src];
                strides[i] = spec.strides()[src];
            }
        }
        for (int axis = 0; axis < srcShape.length; axis++) {
            if (!used[axis] && srcShape[axis] != 1) {
                throw new IllegalArgumentException("Cannot drop axis " + axis + " of size " + srcShape[axis]);
            }
        }
        return new Tensor(TensorSpec.withStrides(dtype(), shape, strides, spec.offset()), data);
    }

    // ==================== Iteration ====================

    /**
     * Visits every index of {@code shape} in row-major order. The index array
     * passed to {@code action} is reused between calls.
     */
    public static void forEachIndex(int[] shape, Consumer<int[]> action) {
        for (int dim : shape) {
            if (dim == 0) {
                return;
            }
        }
        int[] idx = new int[shape.length];
        while (true) {
            action.accept(idx);
            int axis = shape.length - 1;
            while (axis >= 0) {
                idx[axis]++;
                if (idx[axis] < shape[axis]) {
                    break;
                }
                idx[axis] = 0;
                axis--;
            }
            if (axis < 0) {
                return;
            }
        }
    }

    @Override
    public String toString() {
        return "Tensor" + Arrays.toString(spec.shape()) + " " + dtype().shortName();
    }
}
