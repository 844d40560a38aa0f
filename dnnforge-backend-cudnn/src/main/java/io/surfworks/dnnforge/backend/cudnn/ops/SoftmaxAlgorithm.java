package io.surfworks.dnnforge.backend.cudnn.ops;

import io.surfworks.dnnforge.core.graph.ConfigurationException;

/**
 * Speed and accuracy tradeoff of the softmax kernels. {@link #LOG} computes log-softmax.
 */
public enum SoftmaxAlgorithm {
    FAST("fast"),
    ACCURATE("accurate"),
    LOG("log");

    private final String text;

    SoftmaxAlgorithm(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    public static SoftmaxAlgorithm parse(String text) {
        for (SoftmaxAlgorithm algorithm : values()) {
            if (algorithm.text.equals(text)) {
                return algorithm;
            }
        }
        throw new ConfigurationException("Invalid softmax algorithm '" + text + "': expected fast, accurate or log");
    }
}
