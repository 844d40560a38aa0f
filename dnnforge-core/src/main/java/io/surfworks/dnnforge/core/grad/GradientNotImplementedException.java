package io.surfworks.dnnforge.core.grad;

/**
 * Thrown when a gradient that an operator declared as not implemented is
 * actually required, either while building a gradient graph or at execution.
 */
public class GradientNotImplementedException extends RuntimeException {

    public GradientNotImplementedException(String message) {
        super(message);
    }

    public GradientNotImplementedException(String message, Throwable cause) {
        super(message, cause);
    }
}
