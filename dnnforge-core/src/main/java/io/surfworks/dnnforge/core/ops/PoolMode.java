package io.surfworks.dnnforge.core.ops;

import io.surfworks.dnnforge.core.graph.ConfigurationException;

/**
 * Pooling reduction kinds.
 */
public enum PoolMode {
    MAX("max"),
    AVERAGE_INC_PAD("average_inc_pad"),
    AVERAGE_EXC_PAD("average_exc_pad");

    private final String text;

    PoolMode(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    public boolean isAverage() {
        return this != MAX;
    }

    /**
     * Parses a mode name. "average" is accepted as {@link #AVERAGE_INC_PAD}.
     */
    public static PoolMode parse(String text) {
        if ("average".equals(text)) {
            return AVERAGE_INC_PAD;
        }
        for (PoolMode mode : values()) {
            if (mode.text.equals(text)) {
                return mode;
            }
        }
        throw new ConfigurationException("Invalid pooling mode '" + text
                + "': expected max, average_inc_pad or average_exc_pad");
    }
}
