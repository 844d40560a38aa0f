package io.surfworks.dnnforge.core.graph;

/**
 * The static type of a graph edge: a tensor or an opaque native handle.
 */
public sealed interface ValueType permits TensorType, HandleType {

    /**
     * Whether a value of {@code other} may stand in for a value of this type.
     */
    boolean accepts(ValueType other);
}
