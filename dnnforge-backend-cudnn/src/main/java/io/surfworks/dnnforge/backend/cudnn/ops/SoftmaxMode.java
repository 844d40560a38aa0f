package io.surfworks.dnnforge.backend.cudnn.ops;

import io.surfworks.dnnforge.core.graph.ConfigurationException;

/**
 * Normalization axis: over channels at each position, or over channels and
 * all spatial positions of an instance.
 */
public enum SoftmaxMode {
    CHANNEL("channel"),
    INSTANCE("instance");

    private final String text;

    SoftmaxMode(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    public static SoftmaxMode parse(String text) {
        for (SoftmaxMode mode : values()) {
            if (mode.text.equals(text)) {
                return mode;
            }
        }
        throw new ConfigurationException("Invalid softmax mode '" + text + "': expected channel or instance");
    }
}
