package io.surfworks.dnnforge.backend.cudnn.gate;

/**
 * Outcome of a trial compile and link.
 *
 * @param success whether the compiler exited cleanly
 * @param diagnostics compiler output, empty on success
 */
public record CompileResult(boolean success, String diagnostics) {

    public static CompileResult ok() {
        return new CompileResult(true, "");
    }

    public static CompileResult failed(String diagnostics) {
        return new CompileResult(false, diagnostics);
    }
}
