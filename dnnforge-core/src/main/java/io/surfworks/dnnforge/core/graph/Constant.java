package io.surfworks.dnnforge.core.graph;

import java.util.Arrays;

import io.surfworks.dnnforge.core.tensor.ScalarType;
import io.surfworks.dnnforge.core.tensor.Tensor;

/**
 * A value whose data is fixed at graph construction time.
 */
public final class Constant extends Value {

    private final Tensor data;

    private Constant(Tensor data, String name) {
        super(TensorType.of(data.dtype(), data.shape()), null, 0, name);
        this.data = data.copy();
    }

    public static Constant of(Tensor data) {
        return new Constant(data, null);
    }

    public static Constant scalar(ScalarType dtype, double value) {
        return new Constant(Tensor.scalar(dtype, value), null);
    }

    /**
     * A rank-0 int64 constant, the representation of one shape component.
     */
    public static Constant index(long value) {
        return scalar(ScalarType.I64, value);
    }

    /**
     * A copy of the constant data.
     */
    public Tensor data() {
        return data.copy();
    }

    /**
     * The value of a one-element constant.
     */
    public double scalarValue() {
        return data.scalarValue();
    }

    /**
     * True if this constant has a single element equal to {@code expected}.
     */
    public boolean isScalarEqualTo(double expected) {
        return data.elementCount() == 1 && data.scalarValue() == expected;
    }

    @Override
    public boolean isConstant() {
        return true;
    }

    @Override
    public String toString() {
        if (data.elementCount() <= 8) {
            return "const" + Arrays.toString(data.toArray()) + ":" + type();
        }
        return "const:" + type();
    }
}
