package io.surfworks.dnnforge.core.tensor;

import java.util.Arrays;

/**
 * Tensor specification: shape, dtype, strides and a storage offset.
 * Immutable metadata describing how a logical index maps into storage.
 *
 * <p>Strides are in elements, not bytes. A stride may be zero (a broadcast
 * axis) or negative (a reversed axis).
 */
public record TensorSpec(
    int[] shape,
    ScalarType dtype,
    long[] strides,
    long offset
) {
    /**
     * Create a TensorSpec with row-major (C-contiguous) strides.
     */
    public static TensorSpec of(ScalarType dtype, int... shape) {
        for (int dim : shape) {
            if (dim < 0) {
                throw new IllegalArgumentException("Negative dimension in shape " + Arrays.toString(shape));
            }
        }
        return new TensorSpec(shape.clone(), dtype, computeRowMajorStrides(shape), 0);
    }

    /**
     * Create a TensorSpec with explicit strides (e.g. for a permuted view).
     */
    public static TensorSpec withStrides(ScalarType dtype, int[] shape, long[] strides, long offset) {
        if (shape.length != strides.length) {
            throw new IllegalArgumentException("Shape and strides must have same length");
        }
        return new TensorSpec(shape.clone(), dtype, strides.clone(), offset);
    }

    /**
     * Number of dimensions.
     */
    public int rank() {
        return shape.length;
    }

    /**
     * Total number of elements.
     */
    public long elementCount() {
        long count = 1;
        for (int dim : shape) {
            count *= dim;
        }
        return count;
    }

    /**
     * Total size in bytes.
     */
    public long byteSize() {
        return elementCount() * dtype.byteSize();
    }

    /**
     * Compute the storage index of a multi-dimensional index.
     */
    public long storageIndex(int... indices) {
        if (indices.length != shape.length) {
            throw new IllegalArgumentException(
                "Expected " + shape.length + " indices, got " + indices.length);
        }
        long idx = offset;
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] < 0 || indices[i] >= shape[i]) {
                throw new IndexOutOfBoundsException(
                    "Index " + indices[i] + " out of bounds for dimension " + i + " with size " + shape[i]);
            }
            idx += indices[i] * strides[i];
        }
        return idx;
    }

    /**
     * Check if this tensor is laid out row-major with no gaps, starting at offset 0.
     */
    public boolean isContiguous() {
        if (offset != 0) {
            return false;
        }
        long expectedStride = 1;
        for (int i = shape.length - 1; i >= 0; i--) {
            if (shape[i] != 1 && strides[i] != expectedStride) {
                return false;
            }
            expectedStride *= shape[i];
        }
        return true;
    }

    /**
     * Compute row-major (C-contiguous) strides for a shape.
     */
    public static long[] computeRowMajorStrides(int[] shape) {
        long[] strides = new long[shape.length];
        long stride = 1;
        for (int i = shape.length - 1; i >= 0; i--) {
            strides[i] = stride;
            stride *= shape[i];
        }
        return strides;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TensorSpec that)) return false;
        return offset == that.offset
                && dtype == that.dtype
                && Arrays.equals(shape, that.shape)
                && Arrays.equals(strides, that.strides);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(shape);
        result = 31 * result + dtype.hashCode();
        result = 31 * result + Arrays.hashCode(strides);
        result = 31 * result + Long.hashCode(offset);
        return result;
    }

    @Override
    public String toString() {
        return "TensorSpec[shape=" + Arrays.toString(shape) + ", dtype=" + dtype
                + ", strides=" + Arrays.toString(strides) + ", offset=" + offset + "]";
    }
}
