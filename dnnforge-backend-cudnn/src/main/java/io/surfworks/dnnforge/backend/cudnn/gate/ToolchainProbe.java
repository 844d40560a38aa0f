package io.surfworks.dnnforge.backend.cudnn.gate;

import java.util.List;

/**
 * Attempts to compile and link a C source against the native backend.
 */
@FunctionalInterface
public interface ToolchainProbe {

    CompileResult tryCompile(String source, List<String> flags);
}
