package io.surfworks.dnnforge.core.graph;

/**
 * Thrown when input ranks, dimensions or value kinds do not fit an operator.
 */
public class ShapeException extends RuntimeException {

    public ShapeException(String message) {
        super(message);
    }

    public ShapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
