package io.surfworks.dnnforge.backend.cudnn.ops;

import io.surfworks.dnnforge.core.graph.ConfigurationException;

/**
 * Whether filters are flipped (true convolution) or applied as is (cross-correlation).
 */
public enum ConvMode {
    CONVOLUTION("conv"),
    CROSS_CORRELATION("cross");

    private final String text;

    ConvMode(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    public boolean flipsFilters() {
        return this == CONVOLUTION;
    }

    public ConvMode complement() {
        return this == CONVOLUTION ? CROSS_CORRELATION : CONVOLUTION;
    }

    public static ConvMode parse(String text) {
        for (ConvMode mode : values()) {
            if (mode.text.equals(text)) {
                return mode;
            }
        }
        throw new ConfigurationException("Invalid convolution mode '" + text + "': expected conv or cross");
    }
}
