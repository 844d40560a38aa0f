package io.surfworks.dnnforge.backend.cudnn.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.surfworks.dnnforge.backend.cudnn.ops.BackwardAlgorithm;
import io.surfworks.dnnforge.backend.cudnn.ops.ForwardAlgorithm;
import io.surfworks.dnnforge.core.graph.ConfigurationException;

@DisplayName("DnnConfigLoader")
class DnnConfigLoaderTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("a missing file yields the defaults")
    void missingFile() {
        assertEquals(DnnConfig.defaults(), DnnConfigLoader.load(dir.resolve("absent.json")));
    }

    @Test
    @DisplayName("saved settings load back")
    void saveAndLoad() throws IOException {
        Path file = dir.resolve("nested").resolve("cudnn.json");
        DnnConfig config = DnnConfig.defaults()
                .withIncludePath(Path.of("/opt/cudnn/include"))
                .withForwardAlgorithm(ForwardAlgorithm.TIME_ON_SHAPE_CHANGE)
                .withBackwardAlgorithm(BackwardAlgorithm.DETERMINISTIC);

        DnnConfigLoader.save(config, file);

        assertTrue(Files.readString(file).contains("\"time_on_shape_change\""));
        assertEquals(config, DnnConfigLoader.load(file));
    }

    @Test
    @DisplayName("absent fields keep their defaults")
    void partialFile() throws IOException {
        Path file = dir.resolve("cudnn.json");
        Files.writeString(file, "{\"schemaVersion\": 2, \"libraryPath\": \"/opt/cudnn/lib\"}");

        DnnConfig config = DnnConfigLoader.load(file);

        assertEquals(Path.of("/opt/cudnn/lib"), config.libraryPath());
        assertEquals(DnnConfig.DEFAULT_INCLUDE_PATH, config.includePath());
        assertEquals(ForwardAlgorithm.DEFAULT, config.defaultForwardAlgorithm());
    }

    @Test
    @DisplayName("a schema 1 file names the forward algorithm workmem")
    void legacyWorkmem() throws IOException {
        Path file = dir.resolve("cudnn.json");
        Files.writeString(file, "{\"workmem\": \"large\"}");

        DnnConfig config = DnnConfigLoader.load(file);

        assertEquals(ForwardAlgorithm.LARGE, config.defaultForwardAlgorithm());
        assertEquals(StateMigrator.CURRENT_SCHEMA_VERSION, config.schemaVersion());
    }

    @Test
    @DisplayName("unknown algorithm names and newer schemas are rejected")
    void rejectsInvalid() throws IOException {
        Path badAlgo = dir.resolve("algo.json");
        Files.writeString(badAlgo, "{\"defaultForwardAlgorithm\": \"fastest\"}");
        Path newer = dir.resolve("newer.json");
        Files.writeString(newer, "{\"schemaVersion\": 99}");

        assertThrows(ConfigurationException.class, () -> DnnConfigLoader.load(badAlgo));
        assertThrows(ConfigurationException.class, () -> DnnConfigLoader.load(newer));
    }

    @Test
    @DisplayName("an unreadable file falls back to the defaults")
    void unreadable() throws IOException {
        Path file = dir.resolve("cudnn.json");
        Files.writeString(file, "{ not json");

        assertEquals(DnnConfig.defaults(), DnnConfigLoader.load(file));
    }
}
