package io.surfworks.dnnforge.backend.cudnn.gate;

/**
 * Stages of the availability probe, in the order they run.
 */
public enum ProbeStage {
    DEVICE,
    CAPABILITY,
    TOOLCHAIN,
    SESSION,
    VERSION
}
