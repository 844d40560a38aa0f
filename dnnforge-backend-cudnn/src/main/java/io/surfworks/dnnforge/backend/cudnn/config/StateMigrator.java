package io.surfworks.dnnforge.backend.cudnn.config;

import java.util.Set;
import java.util.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.surfworks.dnnforge.core.graph.ConfigurationException;

/**
 * Upgrades stored configuration and operator state documents to the current
 * schema. Runs once, when a document is loaded; nothing downstream sees a
 * legacy layout.
 *
 * <p>Schema 1 documents may:
 * <ul>
 *   <li>name the forward algorithm {@code workmem} instead of {@code algo}
 *       ({@code defaultForwardAlgorithm} in configuration files)</li>
 *   <li>omit {@code inplace} on convolutions, which means false</li>
 *   <li>omit {@code algo} on convolutions, which means the configured default</li>
 *   <li>omit {@code pad} on pooling descriptors, which means no padding</li>
 * </ul>
 */
public final class StateMigrator {

    private static final Logger LOG = Logger.getLogger(StateMigrator.class.getName());

    public static final int CURRENT_SCHEMA_VERSION = 2;

    static final String FORWARD_KIND = "conv";
    static final Set<String> CONVOLUTION_KINDS = Set.of(FORWARD_KIND, "conv_grad_w", "conv_grad_i");
    static final String POOL_DESCRIPTOR_KIND = "pool_desc";

    private StateMigrator() {
    }

    /**
     * Returns an upgraded copy of a configuration document.
     */
    public static ObjectNode migrateConfig(JsonNode document) {
        ObjectNode doc = copy(document, "configuration");
        int version = checkVersion(doc);
        if (version < 2 && doc.has("workmem")) {
            JsonNode workmem = doc.remove("workmem");
            if (!doc.has("defaultForwardAlgorithm")) {
                doc.set("defaultForwardAlgorithm", workmem);
            }
        }
        if (version < CURRENT_SCHEMA_VERSION) {
            LOG.fine(() -> "Migrated configuration from schema " + version);
        }
        doc.put("schemaVersion", CURRENT_SCHEMA_VERSION);
        return doc;
    }

    /**
     * Returns an upgraded copy of one serialized operator.
     *
     * @param state the stored operator, with a {@code kind} field
     * @param config supplies the default algorithms
     */
    public static ObjectNode migrateOperatorState(JsonNode state, DnnConfig config) {
        ObjectNode doc = copy(state, "operator state");
        int version = checkVersion(doc);
        String kind = doc.path("kind").asText("");

        if (CONVOLUTION_KINDS.contains(kind)) {
            if (doc.has("workmem")) {
                if (doc.has("algo")) {
                    throw new ConfigurationException("Operator state for " + kind
                            + " names both workmem and algo; workmem is a deprecated alias of algo");
                }
                doc.set("algo", doc.remove("workmem"));
            }
            if (!doc.has("algo")) {
                doc.put("algo", kind.equals(FORWARD_KIND)
                        ? config.defaultForwardAlgorithm().text()
                        : config.defaultBackwardAlgorithm().text());
            }
            if (!doc.has("inplace")) {
                doc.put("inplace", false);
            }
        } else if (kind.equals(POOL_DESCRIPTOR_KIND) && !doc.has("pad")) {
            ArrayNode pad = doc.putArray("pad");
            for (int i = 0; i < doc.path("window").size(); i++) {
                pad.add(0);
            }
        }

        if (version < CURRENT_SCHEMA_VERSION) {
            LOG.fine(() -> "Migrated " + kind + " state from schema " + version);
        }
        doc.put("schemaVersion", CURRENT_SCHEMA_VERSION);
        return doc;
    }

    private static ObjectNode copy(JsonNode document, String what) {
        if (!(document instanceof ObjectNode object)) {
            throw new ConfigurationException("Stored " + what + " must be a JSON object, got " + document);
        }
        return object.deepCopy();
    }

    private static int checkVersion(ObjectNode doc) {
        int version = doc.path("schemaVersion").asInt(1);
        if (version > CURRENT_SCHEMA_VERSION) {
            throw new ConfigurationException("Stored schema version " + version + " is newer than supported version "
                    + CURRENT_SCHEMA_VERSION);
        }
        return version;
    }
}
