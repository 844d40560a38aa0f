package io.surfworks.dnnforge.backend.cudnn.gate;

/**
 * Query surface for the device the process is bound to.
 */
public interface DeviceBinding {

    /**
     * Identifier of the active device, such as {@code cuda0} or {@code cpu}.
     * Null when no device is bound.
     */
    String activeDevice();

    /**
     * Compute capability of the active device, as {@code sm_XY} or {@code X.Y}.
     */
    String computeCapability();
}
