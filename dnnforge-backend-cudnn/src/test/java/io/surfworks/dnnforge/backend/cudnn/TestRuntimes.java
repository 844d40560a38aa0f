package io.surfworks.dnnforge.backend.cudnn;

import io.surfworks.dnnforge.backend.cudnn.config.DnnConfig;
import io.surfworks.dnnforge.backend.cudnn.gate.AvailabilityGate;
import io.surfworks.dnnforge.backend.cudnn.gate.BackendVersions;
import io.surfworks.dnnforge.backend.cudnn.gate.CompileResult;
import io.surfworks.dnnforge.backend.cudnn.gate.DeviceBinding;

/**
 * Runtimes wired to canned probe results instead of the host.
 */
public final class TestRuntimes {

    /** A device that reports fixed answers. */
    public record StubDevice(String activeDevice, String computeCapability) implements DeviceBinding {
    }

    private TestRuntimes() {
    }

    public static DnnRuntime available(int version) {
        return available(version, DnnConfig.defaults());
    }

    public static DnnRuntime available(int version, DnnConfig config) {
        return new DnnRuntime(config, gate(config, version));
    }

    /**
     * A runtime bound to the CPU, so the probe stops at the device check.
     */
    public static DnnRuntime unavailable() {
        DnnConfig config = DnnConfig.defaults();
        return new DnnRuntime(config, new AvailabilityGate(config, new StubDevice("cpu", "0.0"),
                (source, flags) -> CompileResult.ok(),
                c -> new BackendVersions(5005, 5005)));
    }

    public static AvailabilityGate gate(DnnConfig config, int version) {
        return new AvailabilityGate(config, new StubDevice("cuda0", "sm_52"),
                (source, flags) -> CompileResult.ok(),
                c -> new BackendVersions(version, version));
    }
}
