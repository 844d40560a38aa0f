package io.surfworks.dnnforge.backend.cudnn.gate;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import io.surfworks.dnnforge.backend.cudnn.BackendUnavailableException;
import io.surfworks.dnnforge.backend.cudnn.DnnFeature;
import io.surfworks.dnnforge.backend.cudnn.FeatureUnsupportedException;
import io.surfworks.dnnforge.backend.cudnn.config.DnnConfig;
import io.surfworks.dnnforge.core.graph.ConfigurationException;

/**
 * Decides once whether the accelerated backend is usable and at which version.
 *
 * <p>The probe runs on the first query and its verdict is kept for the
 * lifetime of the gate, whatever the outcome. Concurrent first queries block
 * until the single probe finishes. Stages run in order and the first failure
 * wins:
 * <ol>
 *   <li>the bound device belongs to the {@code cuda} family</li>
 *   <li>its compute capability is at least {@link #MINIMUM_CAPABILITY}</li>
 *   <li>a trial program compiles and links against the library</li>
 *   <li>a session opens and reports header and library versions</li>
 *   <li>the version is consistent, recent enough and not a known-broken release candidate</li>
 * </ol>
 */
public final class AvailabilityGate {

    private static final Logger LOG = Logger.getLogger(AvailabilityGate.class.getName());

    public static final ComputeCapability MINIMUM_CAPABILITY = new ComputeCapability(3, 0);
    public static final int MINIMUM_VERSION = 2000;
    /** Release candidates of v3 that produce wrong results. */
    public static final int FIRST_BROKEN_VERSION = 3000;
    public static final int LAST_BROKEN_VERSION = 3006;

    static final String TRIAL_SOURCE = """
            #include <stdio.h>
            #include <cudnn.h>

            int main(void) {
                cudnnHandle_t handle = NULL;
                if (cudnnCreate(&handle) != CUDNN_STATUS_SUCCESS) {
                    fprintf(stderr, "cudnnCreate failed\\n");
                    return 1;
                }
                cudnnDestroy(handle);
                return 0;
            }
            """;

    private final DnnConfig config;
    private final DeviceBinding device;
    private final ToolchainProbe toolchain;
    private final SessionProbe session;
    private final Object lock = new Object();
    private volatile GateState state;

    public AvailabilityGate(DnnConfig config, DeviceBinding device, ToolchainProbe toolchain, SessionProbe session) {
        this.config = config;
        this.device = device;
        this.toolchain = toolchain;
        this.session = session;
    }

    /**
     * A gate wired to the real host: {@code nvidia-smi}, the system C compiler
     * and the configured header and library directories.
     */
    public static AvailabilityGate forHost(DnnConfig config) {
        return new AvailabilityGate(config, new NvidiaDeviceBinding(), new ProcessToolchainProbe(),
                new HeaderSessionProbe());
    }

    /**
     * The cached verdict, probing first if no query has been made yet.
     */
    public GateState state() {
        GateState current = state;
        if (current == null) {
            synchronized (lock) {
                current = state;
                if (current == null) {
                    current = probe();
                    report(current);
                    state = current;
                }
            }
        }
        return current;
    }

    /**
     * Whether the probe has already run.
     */
    public boolean isResolved() {
        return state != null;
    }

    public boolean isAvailable() {
        return state() instanceof GateState.Available;
    }

    /**
     * The diagnostic, present only when the backend is unavailable.
     */
    public Optional<String> reason() {
        if (state() instanceof GateState.Unavailable unavailable) {
            return Optional.of(unavailable.reason());
        }
        return Optional.empty();
    }

    /**
     * The detected library version.
     *
     * @throws BackendUnavailableException if the backend is unavailable
     */
    public int version() {
        GateState current = state();
        if (current instanceof GateState.Available available) {
            return available.version();
        }
        throw new BackendUnavailableException(((GateState.Unavailable) current).describe());
    }

    /**
     * @throws BackendUnavailableException if the backend is unavailable
     */
    public void requireAvailable() {
        version();
    }

    public boolean supports(DnnFeature feature) {
        return isAvailable() && version() >= feature.minimumVersion();
    }

    /**
     * @throws BackendUnavailableException if the backend is unavailable
     * @throws FeatureUnsupportedException if the detected version predates {@code feature}
     */
    public void require(DnnFeature feature) {
        int detected = version();
        if (detected < feature.minimumVersion()) {
            throw new FeatureUnsupportedException(feature.description(), feature.minimumVersion(), detected);
        }
    }

    // ==================== Probe ====================

    private GateState probe() {
        String active;
        try {
            active = device.activeDevice();
        } catch (RuntimeException e) {
            return unavailable(ProbeStage.DEVICE, "not on required device family: device query failed: "
                    + e.getMessage());
        }
        if (active == null || !active.startsWith("cuda")) {
            return unavailable(ProbeStage.DEVICE, "not on required device family: cuda required, active device is "
                    + (active == null ? "none" : active));
        }

        ComputeCapability capability;
        try {
            capability = ComputeCapability.parse(device.computeCapability());
        } catch (ConfigurationException e) {
            return unavailable(ProbeStage.CAPABILITY, e.getMessage());
        } catch (RuntimeException e) {
            return unavailable(ProbeStage.CAPABILITY, "Compute capability query failed: " + e.getMessage());
        }
        if (!capability.isAtLeast(MINIMUM_CAPABILITY)) {
            return unavailable(ProbeStage.CAPABILITY, "Device " + active + " has compute capability " + capability
                    + ", cuDNN requires at least " + MINIMUM_CAPABILITY);
        }

        CompileResult compiled;
        try {
            compiled = toolchain.tryCompile(TRIAL_SOURCE, List.of(
                    "-I" + config.includePath(),
                    "-L" + config.libraryPath(),
                    "-lcudnn"));
        } catch (RuntimeException e) {
            return unavailable(ProbeStage.TOOLCHAIN, "Can not compile with cuDNN. The compiler failed to run: "
                    + e.getMessage());
        }
        if (!compiled.success()) {
            return unavailable(ProbeStage.TOOLCHAIN, "Can not compile with cuDNN. We got this error:\n"
                    + compiled.diagnostics());
        }

        BackendVersions versions;
        try {
            versions = session.open(config);
        } catch (IOException | RuntimeException e) {
            return unavailable(ProbeStage.SESSION, "Could not open a cuDNN session: " + e.getMessage());
        }
        return checkVersion(versions);
    }

    private static GateState checkVersion(BackendVersions versions) {
        if (!versions.isConsistent()) {
            return unavailable(ProbeStage.VERSION, "Mixed dnn version. The header is version "
                    + versions.headerVersion() + " while the library is version " + versions.libraryVersion() + ".");
        }
        int version = versions.libraryVersion();
        if (version < MINIMUM_VERSION) {
            return unavailable(ProbeStage.VERSION, "cuDNN version " + version
                    + " is unsupported, must upgrade to version " + MINIMUM_VERSION + " or newer");
        }
        if (version >= FIRST_BROKEN_VERSION && version <= LAST_BROKEN_VERSION) {
            return unavailable(ProbeStage.VERSION, "cuDNN version " + version
                    + " is a release candidate with known bugs, upgrade to the final v3 release");
        }
        return new GateState.Available(version);
    }

    private static GateState unavailable(ProbeStage stage, String reason) {
        return new GateState.Unavailable(stage, reason);
    }

    private static void report(GateState verdict) {
        if (verdict instanceof GateState.Available available) {
            LOG.info("cuDNN available, version " + available.version());
        } else {
            LOG.warning(((GateState.Unavailable) verdict).describe());
        }
    }
}
