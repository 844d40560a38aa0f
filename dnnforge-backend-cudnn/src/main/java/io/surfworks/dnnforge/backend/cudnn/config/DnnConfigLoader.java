package io.surfworks.dnnforge.backend.cudnn.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.surfworks.dnnforge.backend.cudnn.ops.BackwardAlgorithm;
import io.surfworks.dnnforge.backend.cudnn.ops.ForwardAlgorithm;

/**
 * Loads and saves {@link DnnConfig}.
 *
 * <p>A missing file yields {@link DnnConfig#defaults()}. Fields absent from
 * the file keep their default value. Unknown algorithm names are rejected.
 */
public final class DnnConfigLoader {

    private static final Logger LOG = Logger.getLogger(DnnConfigLoader.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    private DnnConfigLoader() {
    }

    /**
     * Loads configuration from the default config file.
     */
    public static DnnConfig load() {
        return load(DnnConfig.configFile());
    }

    /**
     * Loads configuration from a specific file.
     *
     * @param configFile path to the config file
     * @return the loaded configuration
     * @throws io.surfworks.dnnforge.core.graph.ConfigurationException if a value is invalid
     */
    public static DnnConfig load(Path configFile) {
        DnnConfig base = DnnConfig.defaults();
        if (!Files.exists(configFile)) {
            return base;
        }

        JsonNode root;
        try {
            root = JSON.readTree(configFile.toFile());
        } catch (IOException e) {
            LOG.warning("Ignoring unreadable config file " + configFile + ": " + e.getMessage());
            return base;
        }

        ObjectNode doc = StateMigrator.migrateConfig(root);
        return new DnnConfig(
                doc.get("schemaVersion").asInt(),
                Path.of(getStringOrDefault(doc, "includePath", base.includePath().toString())),
                Path.of(getStringOrDefault(doc, "libraryPath", base.libraryPath().toString())),
                ForwardAlgorithm.parse(getStringOrDefault(doc, "defaultForwardAlgorithm",
                        base.defaultForwardAlgorithm().text())),
                BackwardAlgorithm.parse(getStringOrDefault(doc, "defaultBackwardAlgorithm",
                        base.defaultBackwardAlgorithm().text())));
    }

    /**
     * Saves configuration to a specific file.
     *
     * @param config the configuration to save
     * @param configFile path to write the config
     * @throws IOException if saving fails
     */
    public static void save(DnnConfig config, Path configFile) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        ObjectNode root = JSON.createObjectNode();
        root.put("schemaVersion", StateMigrator.CURRENT_SCHEMA_VERSION);
        root.put("includePath", config.includePath().toString());
        root.put("libraryPath", config.libraryPath().toString());
        root.put("defaultForwardAlgorithm", config.defaultForwardAlgorithm().text());
        root.put("defaultBackwardAlgorithm", config.defaultBackwardAlgorithm().text());

        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), root);
    }

    private static String getStringOrDefault(JsonNode node, String field, String defaultValue) {
        if (node.has(field) && !node.get(field).isNull()) {
            return node.get(field).asText();
        }
        return defaultValue;
    }
}
