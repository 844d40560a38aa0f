package io.surfworks.dnnforge.backend.cudnn.gate;

import java.io.IOException;

import io.surfworks.dnnforge.backend.cudnn.config.DnnConfig;

/**
 * Opens a backend session once and reports the versions it sees.
 */
@FunctionalInterface
public interface SessionProbe {

    BackendVersions open(DnnConfig config) throws IOException;
}
