package io.surfworks.dnnforge.core.graph;

/**
 * A typed edge of the operator graph.
 *
 * <p>A value is either a graph input (no owner), a {@link Constant}, or output
 * {@link #index()} of its owning {@link Node}. Identity is by reference: two
 * distinct values are never equal, even with the same type and name.
 */
public class Value {

    private final ValueType type;
    private final Node owner;
    private final int index;
    private final String name;

    Value(ValueType type, Node owner, int index, String name) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        this.type = type;
        this.owner = owner;
        this.index = index;
        this.name = name;
    }

    /**
     * Creates a free value to be used as a graph input.
     */
    public static Value input(ValueType type, String name) {
        return new Value(type, null, 0, name);
    }

    public ValueType type() {
        return type;
    }

    /**
     * The node producing this value, or null for graph inputs and constants.
     */
    public Node owner() {
        return owner;
    }

    public int index() {
        return index;
    }

    public String name() {
        return name;
    }

    public boolean isConstant() {
        return false;
    }

    /**
     * Returns the tensor type of this value.
     *
     * @throws ShapeException if this value is not a tensor
     */
    public TensorType tensorType() {
        if (type instanceof TensorType t) {
            return t;
        }
        throw new ShapeException("Expected a tensor value, got " + type + " for " + this);
    }

    /**
     * Returns true if this value is produced by an operator of the given kind.
     */
    public boolean isProducedBy(OperatorKind kind) {
        return owner != null && owner.operator().kind().equals(kind);
    }

    @Override
    public String toString() {
        String label = name != null ? name : (owner != null ? owner.operator().kind().name() + "." + index : "v");
        return label + ":" + type;
    }
}
