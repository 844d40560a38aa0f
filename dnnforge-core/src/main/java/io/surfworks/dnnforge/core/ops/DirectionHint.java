package io.surfworks.dnnforge.core.ops;

/**
 * Caller's hint about what a convolution computes, used to pick a cheaper
 * but equivalent lowering.
 */
public enum DirectionHint {
    /** No hint. */
    NONE("none"),
    /** Forward pass; a full convolution may still be lowered as a gradient adjoint. */
    FORWARD("forward"),
    /** Forward pass, always lowered as a forward convolution. */
    FORCE_FORWARD("forward!"),
    /** The convolution is really the gradient with respect to the weights. */
    BPROP_WEIGHTS("bprop weights"),
    /** The convolution is really the gradient with respect to the inputs. */
    BPROP_INPUTS("bprop inputs");

    private final String text;

    DirectionHint(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    public static DirectionHint parse(String text) {
        if (text == null) {
            return NONE;
        }
        for (DirectionHint hint : values()) {
            if (hint.text.equals(text)) {
                return hint;
            }
        }
        throw new IllegalArgumentException("Unknown direction hint: " + text);
    }
}
