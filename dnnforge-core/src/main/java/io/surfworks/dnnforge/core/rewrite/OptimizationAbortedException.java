package io.surfworks.dnnforge.core.rewrite;

/**
 * Aborts a whole optimization run. Never caught by {@link RewriteDriver}.
 */
public class OptimizationAbortedException extends RuntimeException {

    public OptimizationAbortedException(String message) {
        super(message);
    }

    public OptimizationAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
