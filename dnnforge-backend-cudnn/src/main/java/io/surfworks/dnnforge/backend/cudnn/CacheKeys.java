package io.surfworks.dnnforge.backend.cudnn;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import io.surfworks.dnnforge.core.graph.Constant;
import io.surfworks.dnnforge.core.graph.Node;
import io.surfworks.dnnforge.core.graph.OperationGraph;
import io.surfworks.dnnforge.core.graph.Operator;
import io.surfworks.dnnforge.core.graph.Value;
import io.surfworks.dnnforge.core.rewrite.RuleRegistry;

/**
 * Keys for a compiled-artifact cache: a SHA-256 over the structure of an
 * operator, graph or rule set, suffixed with the backend version so that a
 * version change invalidates every key.
 *
 * <p>Keys look like {@code 3f2a...9c-v5005}.
 */
public final class CacheKeys {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private CacheKeys() {
    }

    public static String forOperator(Operator operator, int backendVersion) {
        return digest(describe(operator), backendVersion);
    }

    /**
     * Key over every node of {@code graph} in topological order and how the nodes are wired.
     */
    public static String forGraph(OperationGraph graph, int backendVersion) {
        Map<Node, Integer> positions = new IdentityHashMap<>();
        List<Node> nodes = graph.nodes();
        JsonArray body = new JsonArray();
        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            positions.put(node, i);
            JsonObject entry = new JsonObject();
            entry.add("op", describe(node.operator()));
            JsonArray inputs = new JsonArray();
            for (Value in : node.inputs()) {
                inputs.add(reference(graph, positions, in));
            }
            entry.add("inputs", inputs);
            body.add(entry);
        }
        JsonArray outputs = new JsonArray();
        for (Value out : graph.outputs()) {
            outputs.add(reference(graph, positions, out));
        }
        JsonObject root = new JsonObject();
        root.add("nodes", body);
        root.add("outputs", outputs);
        return digest(root, backendVersion);
    }

    /**
     * Key over the registered rewrites, their passes, priorities and tags.
     */
    public static String forRegistry(RuleRegistry registry, int backendVersion) {
        JsonArray entries = new JsonArray();
        for (RuleRegistry.Entry entry : registry.entries()) {
            JsonObject json = new JsonObject();
            json.addProperty("pass", entry.pass());
            json.addProperty("priority", entry.priority());
            json.add("tags", GSON.toJsonTree(entry.tags().stream().sorted().toList()));
            json.addProperty("rewrite", entry.rewrite().name());
            json.addProperty("class", entry.rewrite().getClass().getName());
            entries.add(json);
        }
        return digest(entries, backendVersion);
    }

    static JsonObject describe(Operator operator) {
        JsonElement tree = GSON.toJsonTree(operator);
        JsonObject json = tree.isJsonObject() ? tree.getAsJsonObject() : new JsonObject();
        json.addProperty("kind", operator.kind().toString());
        json.addProperty("class", operator.getClass().getName());
        return json;
    }

    private static String reference(OperationGraph graph, Map<Node, Integer> positions, Value value) {
        if (value instanceof Constant constant) {
            return "const" + constant.type() + GSON.toJson(constant.data().toArray());
        }
        Node owner = value.owner();
        if (owner == null) {
            return "input" + graph.inputs().indexOf(value) + ":" + value.type();
        }
        return "node" + positions.get(owner) + "." + value.index();
    }

    private static String digest(JsonElement json, int backendVersion) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha.digest(GSON.toJson(json).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash) + "-v" + backendVersion;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
