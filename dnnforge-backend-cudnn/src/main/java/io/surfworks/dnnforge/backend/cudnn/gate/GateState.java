package io.surfworks.dnnforge.backend.cudnn.gate;

/**
 * Terminal verdict of the availability probe.
 */
public sealed interface GateState permits GateState.Available, GateState.Unavailable {

    /**
     * The backend can be used.
     *
     * @param version library version, {@code major * 1000 + minor * 100 + patch}
     */
    record Available(int version) implements GateState {
    }

    /**
     * The backend cannot be used.
     *
     * @param stage the probe stage that failed
     * @param reason human-readable diagnostic
     */
    record Unavailable(ProbeStage stage, String reason) implements GateState {

        public String describe() {
            return "cuDNN unavailable (" + stage.name().toLowerCase() + " check): " + reason;
        }
    }
}
