package io.surfworks.dnnforge.backend.cudnn;

/**
 * Thrown when the accelerated backend cannot be used on this host.
 *
 * <p>The message carries the diagnostic recorded by the availability gate,
 * which names the probe stage that failed.
 */
public class BackendUnavailableException extends RuntimeException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
