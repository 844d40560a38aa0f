package io.surfworks.dnnforge.backend.cudnn.gate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Runs the system C compiler on a trial source in a scratch directory.
 */
public final class ProcessToolchainProbe implements ToolchainProbe {

    private static final Logger LOG = Logger.getLogger(ProcessToolchainProbe.class.getName());

    private final String compiler;
    private final long timeoutSeconds;

    public ProcessToolchainProbe() {
        this("cc", 120);
    }

    public ProcessToolchainProbe(String compiler, long timeoutSeconds) {
        this.compiler = compiler;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public CompileResult tryCompile(String source, List<String> flags) {
        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("dnnforge-probe");
            Path sourceFile = workDir.resolve("probe.c");
            Files.writeString(sourceFile, source, StandardCharsets.UTF_8);

            List<String> command = new ArrayList<>();
            command.add(compiler);
            command.add(sourceFile.toString());
            command.add("-o");
            command.add(workDir.resolve("probe").toString());
            command.addAll(flags);

            // output goes to a file so a hung compiler cannot block us past the timeout
            Path log = workDir.resolve("probe.log");
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            pb.redirectOutput(log.toFile());
            pb.directory(workDir.toFile());
            Process process = pb.start();

            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly().waitFor(timeoutSeconds, TimeUnit.SECONDS);
                return CompileResult.failed(compiler + " timed out after " + timeoutSeconds + " seconds");
            }
            if (process.exitValue() != 0) {
                return CompileResult.failed(Files.readString(log, StandardCharsets.UTF_8));
            }
            return CompileResult.ok();
        } catch (IOException e) {
            return CompileResult.failed("Could not run " + compiler + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompileResult.failed("Interrupted while running " + compiler);
        } finally {
            deleteQuietly(workDir);
        }
    }

    private static void deleteQuietly(Path dir) {
        if (dir == null) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path p : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            LOG.log(Level.FINE, "Could not clean up " + dir, e);
        }
    }
}
