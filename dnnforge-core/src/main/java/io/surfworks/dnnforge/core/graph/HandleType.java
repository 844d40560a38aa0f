package io.surfworks.dnnforge.core.graph;

/**
 * Type of an opaque native resource handle, tagged with the native type name
 * and the name of the function that releases it.
 */
public record HandleType(String nativeTypeName, String releaseFunction) implements ValueType {

    public HandleType {
        if (nativeTypeName == null || nativeTypeName.isBlank()) {
            throw new IllegalArgumentException("nativeTypeName must not be blank");
        }
    }

    @Override
    public boolean accepts(ValueType other) {
        return equals(other);
    }

    @Override
    public String toString() {
        return "handle<" + nativeTypeName + ">";
    }
}
