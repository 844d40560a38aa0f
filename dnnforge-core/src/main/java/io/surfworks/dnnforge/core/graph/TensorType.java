package io.surfworks.dnnforge.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import io.surfworks.dnnforge.core.tensor.ScalarType;

/**
 * Tensor type with element kind, rank and per-dimension static sizes.
 *
 * <p>A dimension of {@link #UNKNOWN} is only known at execution time. The rank
 * and element kind are always static.
 */
public record TensorType(ScalarType dtype, List<Integer> shape) implements ValueType {

    public static final int UNKNOWN = -1;

    public TensorType {
        if (dtype == null) {
            throw new IllegalArgumentException("dtype must not be null");
        }
        shape = List.copyOf(shape);
        for (int dim : shape) {
            if (dim < UNKNOWN) {
                throw new IllegalArgumentException("Invalid dimension " + dim + " in " + shape);
            }
        }
    }

    public static TensorType of(ScalarType dtype, int... shape) {
        List<Integer> dims = new ArrayList<>(shape.length);
        for (int dim : shape) {
            dims.add(dim);
        }
        return new TensorType(dtype, dims);
    }

    /**
     * A type of the given rank with every dimension unknown.
     */
    public static TensorType ofRank(ScalarType dtype, int rank) {
        return new TensorType(dtype, Collections.nCopies(rank, UNKNOWN));
    }

    public static TensorType scalar(ScalarType dtype) {
        return new TensorType(dtype, List.of());
    }

    public int rank() {
        return shape.size();
    }

    public int dim(int axis) {
        return shape.get(axis);
    }

    public boolean isKnown(int axis) {
        return shape.get(axis) != UNKNOWN;
    }

    /**
     * Per-axis flag: statically known to be of size 1.
     */
    public List<Boolean> broadcastPattern() {
        return shape.stream().map(d -> d == 1).toList();
    }

    public TensorType withShape(List<Integer> newShape) {
        return new TensorType(dtype, newShape);
    }

    public TensorType withDtype(ScalarType newDtype) {
        return new TensorType(newDtype, shape);
    }

    @Override
    public boolean accepts(ValueType other) {
        if (!(other instanceof TensorType t)) {
            return false;
        }
        if (t.dtype != dtype || t.rank() != rank()) {
            return false;
        }
        for (int i = 0; i < rank(); i++) {
            if (isKnown(i) && t.isKnown(i) && dim(i) != t.dim(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns a compact string like {@code tensor<2x3x?x?xf32>}.
     */
    @Override
    public String toString() {
        if (shape.isEmpty()) {
            return "tensor<" + dtype.shortName() + ">";
        }
        String dims = shape.stream()
                .map(d -> d == UNKNOWN ? "?" : String.valueOf(d))
                .collect(Collectors.joining("x"));
        return "tensor<" + dims + "x" + dtype.shortName() + ">";
    }
}
