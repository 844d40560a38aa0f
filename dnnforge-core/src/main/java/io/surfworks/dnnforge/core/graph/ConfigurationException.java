package io.surfworks.dnnforge.core.graph;

/**
 * Thrown when operator parameters (padding, stride, window, modes) are malformed.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
