package io.surfworks.dnnforge.backend.cudnn.gate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Device binding backed by {@code nvidia-smi}.
 *
 * <p>The device at {@code deviceIndex} is reported as {@code cuda<index>} when
 * {@code nvidia-smi} lists it, and as {@code cpu} otherwise.
 */
public final class NvidiaDeviceBinding implements DeviceBinding {

    private static final Logger LOG = Logger.getLogger(NvidiaDeviceBinding.class.getName());
    private static final long TIMEOUT_SECONDS = 10;

    private final int deviceIndex;
    private final Function<List<String>, List<String>> runner;
    private volatile String capability;

    public NvidiaDeviceBinding() {
        this(0);
    }

    public NvidiaDeviceBinding(int deviceIndex) {
        this(deviceIndex, NvidiaDeviceBinding::run);
    }

    NvidiaDeviceBinding(int deviceIndex, Function<List<String>, List<String>> runner) {
        this.deviceIndex = deviceIndex;
        this.runner = runner;
    }

    @Override
    public String activeDevice() {
        return queryCapability().isEmpty() ? "cpu" : "cuda" + deviceIndex;
    }

    @Override
    public String computeCapability() {
        return queryCapability();
    }

    /**
     * Runs {@code nvidia-smi} on the first call only; both device queries read the same answer.
     */
    private String queryCapability() {
        String cached = capability;
        if (cached == null) {
            synchronized (this) {
                cached = capability;
                if (cached == null) {
                    cached = parseCapabilityLine(runner.apply(List.of("nvidia-smi", "--query-gpu=compute_cap",
                            "--format=csv,noheader", "-i", String.valueOf(deviceIndex))));
                    capability = cached;
                }
            }
        }
        return cached;
    }

    /**
     * First non-blank line of {@code nvidia-smi} CSV output, or empty.
     */
    static String parseCapabilityLine(List<String> lines) {
        for (String line : lines) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && Character.isDigit(trimmed.charAt(0))) {
                return trimmed;
            }
        }
        return "";
    }

    private static List<String> run(List<String> command) {
        Path output = null;
        try {
            output = Files.createTempFile("dnnforge-smi", ".out");
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            pb.redirectOutput(output.toFile());
            Process process = pb.start();
            if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                LOG.fine(() -> String.join(" ", command) + " timed out");
                return List.of();
            }
            return process.exitValue() == 0 ? Files.readAllLines(output, StandardCharsets.UTF_8) : List.of();
        } catch (IOException e) {
            LOG.fine(() -> "nvidia-smi not runnable: " + e.getMessage());
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        } finally {
            if (output != null) {
                try {
                    Files.deleteIfExists(output);
                } catch (IOException e) {
                    LOG.log(Level.FINE, "Could not delete " + output, e);
                }
            }
        }
    }
}
