package io.surfworks.dnnforge.backend.cudnn.config;

import java.nio.file.Path;
import java.util.Objects;

import io.surfworks.dnnforge.backend.cudnn.ops.BackwardAlgorithm;
import io.surfworks.dnnforge.backend.cudnn.ops.ForwardAlgorithm;

/**
 * Backend configuration, read once before the availability probe runs.
 *
 * <p>Stored in {@code ~/.config/dnnforge/cudnn.json} by default. Older files
 * are upgraded by {@link StateMigrator} when loaded.
 *
 * @param schemaVersion version of the stored document layout
 * @param includePath directory holding {@code cudnn.h}
 * @param libraryPath directory holding {@code libcudnn}
 * @param defaultForwardAlgorithm algorithm for forward convolutions that do not name one
 * @param defaultBackwardAlgorithm algorithm for gradient convolutions that do not name one
 */
public record DnnConfig(
        int schemaVersion,
        Path includePath,
        Path libraryPath,
        ForwardAlgorithm defaultForwardAlgorithm,
        BackwardAlgorithm defaultBackwardAlgorithm
) {

    public static final Path DEFAULT_INCLUDE_PATH = Path.of("/usr/local/cuda/include");
    public static final Path DEFAULT_LIBRARY_PATH = Path.of("/usr/local/cuda/lib64");

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(System.getProperty("user.home"), ".config", "dnnforge");

    /** Config file name */
    public static final String CONFIG_FILE = "cudnn.json";

    public DnnConfig {
        Objects.requireNonNull(includePath, "includePath cannot be null");
        Objects.requireNonNull(libraryPath, "libraryPath cannot be null");
        Objects.requireNonNull(defaultForwardAlgorithm, "defaultForwardAlgorithm cannot be null");
        Objects.requireNonNull(defaultBackwardAlgorithm, "defaultBackwardAlgorithm cannot be null");
    }

    public static DnnConfig defaults() {
        return new DnnConfig(StateMigrator.CURRENT_SCHEMA_VERSION, DEFAULT_INCLUDE_PATH, DEFAULT_LIBRARY_PATH,
                ForwardAlgorithm.DEFAULT, BackwardAlgorithm.DEFAULT);
    }

    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    public DnnConfig withIncludePath(Path path) {
        return new DnnConfig(schemaVersion, path, libraryPath, defaultForwardAlgorithm, defaultBackwardAlgorithm);
    }

    public DnnConfig withLibraryPath(Path path) {
        return new DnnConfig(schemaVersion, includePath, path, defaultForwardAlgorithm, defaultBackwardAlgorithm);
    }

    public DnnConfig withForwardAlgorithm(ForwardAlgorithm algorithm) {
        return new DnnConfig(schemaVersion, includePath, libraryPath, algorithm, defaultBackwardAlgorithm);
    }

    public DnnConfig withBackwardAlgorithm(BackwardAlgorithm algorithm) {
        return new DnnConfig(schemaVersion, includePath, libraryPath, defaultForwardAlgorithm, algorithm);
    }
}
