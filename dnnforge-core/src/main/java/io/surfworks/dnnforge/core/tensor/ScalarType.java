package io.surfworks.dnnforge.core.tensor;

/**
 * Scalar element types for tensors.
 */
public enum ScalarType {
    F16(2, false, "float16"),
    F32(4, false, "float32"),
    F64(8, false, "float64"),
    I32(4, true, "int32"),
    I64(8, true, "int64"),
    BOOL(1, false, "bool");

    private final int byteSize;
    private final boolean isInteger;
    private final String dtypeName;

    ScalarType(int byteSize, boolean isInteger, String dtypeName) {
        this.byteSize = byteSize;
        this.isInteger = isInteger;
        this.dtypeName = dtypeName;
    }

    public int byteSize() {
        return byteSize;
    }

    public boolean isInteger() {
        return isInteger;
    }

    /**
     * The dtype name used in serialized operator state ("float32", "int64", ...).
     */
    public String dtypeName() {
        return dtypeName;
    }

    /**
     * Short name used in type strings (f32, i64, ...).
     */
    public String shortName() {
        return switch (this) {
            case F16 -> "f16";
            case F32 -> "f32";
            case F64 -> "f64";
            case I32 -> "i32";
            case I64 -> "i64";
            case BOOL -> "i1";
        };
    }

    /**
     * Rounds a value to what this element type can hold.
     */
    public double coerce(double value) {
        return switch (this) {
            case F16, F32 -> (float) value;
            case F64 -> value;
            case I32 -> (int) value;
            case I64 -> (long) value;
            case BOOL -> value != 0 ? 1 : 0;
        };
    }
}
