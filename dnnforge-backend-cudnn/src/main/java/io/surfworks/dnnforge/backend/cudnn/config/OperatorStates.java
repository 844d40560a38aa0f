package io.surfworks.dnnforge.backend.cudnn.config;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.surfworks.dnnforge.backend.cudnn.DnnRuntime;
import io.surfworks.dnnforge.backend.cudnn.descriptor.ConvolutionDescriptorBuilder;
import io.surfworks.dnnforge.backend.cudnn.descriptor.PoolingDescriptorBuilder;
import io.surfworks.dnnforge.backend.cudnn.ops.BackwardAlgorithm;
import io.surfworks.dnnforge.backend.cudnn.ops.ConvMode;
import io.surfworks.dnnforge.backend.cudnn.ops.DnnConvolution;
import io.surfworks.dnnforge.backend.cudnn.ops.DnnConvolutionGradInputs;
import io.surfworks.dnnforge.backend.cudnn.ops.DnnConvolutionGradWeights;
import io.surfworks.dnnforge.backend.cudnn.ops.DnnConvolutionOp;
import io.surfworks.dnnforge.backend.cudnn.ops.DnnSoftmax;
import io.surfworks.dnnforge.backend.cudnn.ops.ForwardAlgorithm;
import io.surfworks.dnnforge.backend.cudnn.ops.SoftmaxAlgorithm;
import io.surfworks.dnnforge.backend.cudnn.ops.SoftmaxMode;
import io.surfworks.dnnforge.core.graph.ConfigurationException;
import io.surfworks.dnnforge.core.graph.Operator;
import io.surfworks.dnnforge.core.ops.BorderMode;
import io.surfworks.dnnforge.core.ops.PoolMode;

/**
 * JSON form of the accelerated operators, for storing compiled graphs.
 *
 * <p>Reading runs {@link StateMigrator} first, so states written by older
 * versions load with today's defaults.
 */
public final class OperatorStates {

    private static final ObjectMapper JSON = new ObjectMapper();

    private OperatorStates() {
    }

    /**
     * Serializes an accelerated operator.
     *
     * @throws ConfigurationException if the operator has no stored form
     */
    public static ObjectNode write(Operator operator) {
        ObjectNode state = JSON.createObjectNode();
        state.put("schemaVersion", StateMigrator.CURRENT_SCHEMA_VERSION);
        state.put("kind", operator.kind().name());
        if (operator instanceof DnnConvolutionOp<?> conv) {
            state.put("algo", algorithmText(conv));
            state.put("inplace", conv.inplace());
        } else if (operator instanceof ConvolutionDescriptorBuilder desc) {
            state.put("border", desc.border().toString());
            putInts(state.putArray("subsample"), desc.subsample());
            state.put("mode", desc.mode().text());
        } else if (operator instanceof PoolingDescriptorBuilder desc) {
            putInts(state.putArray("window"), desc.window());
            putInts(state.putArray("stride"), desc.stride());
            putInts(state.putArray("pad"), desc.pad());
            state.put("mode", desc.mode().text());
        } else if (operator instanceof DnnSoftmax softmax) {
            state.put("algo", softmax.algorithm().text());
            state.put("mode", softmax.mode().text());
        } else {
            throw new ConfigurationException("No stored form for operator " + operator.kind());
        }
        return state;
    }

    /**
     * Rebuilds an operator from its stored form, checking it against the backend.
     *
     * @throws ConfigurationException if the state is malformed
     * @throws io.surfworks.dnnforge.backend.cudnn.FeatureUnsupportedException if the backend is too old for it
     */
    public static Operator read(JsonNode stored, DnnRuntime runtime) {
        ObjectNode state = StateMigrator.migrateOperatorState(stored, runtime.config());
        String kind = state.path("kind").asText("");
        switch (kind) {
            case "conv": {
                DnnConvolution op = new DnnConvolution(ForwardAlgorithm.parse(state.get("algo").asText()),
                        state.get("inplace").asBoolean());
                op.checkSupported(runtime);
                return op;
            }
            case "conv_grad_w": {
                DnnConvolutionGradWeights op = new DnnConvolutionGradWeights(
                        BackwardAlgorithm.parse(state.get("algo").asText()), state.get("inplace").asBoolean());
                op.checkSupported(runtime);
                return op;
            }
            case "conv_grad_i": {
                DnnConvolutionGradInputs op = new DnnConvolutionGradInputs(
                        BackwardAlgorithm.parse(state.get("algo").asText()), state.get("inplace").asBoolean());
                op.checkSupported(runtime);
                return op;
            }
            case "conv_desc":
                return ConvolutionDescriptorBuilder.create(runtime,
                        BorderMode.parse(required(state, "border").asText()),
                        ints(required(state, "subsample")),
                        ConvMode.parse(state.path("mode").asText(ConvMode.CONVOLUTION.text())));
            case "pool_desc":
                return PoolingDescriptorBuilder.create(runtime,
                        ints(required(state, "window")),
                        ints(required(state, "stride")),
                        ints(state.get("pad")),
                        PoolMode.parse(state.path("mode").asText(PoolMode.MAX.text())));
            case "softmax":
                return DnnSoftmax.create(runtime,
                        SoftmaxAlgorithm.parse(state.path("algo").asText(SoftmaxAlgorithm.ACCURATE.text())),
                        SoftmaxMode.parse(state.path("mode").asText(SoftmaxMode.CHANNEL.text())));
            default:
                throw new ConfigurationException("Unknown stored operator kind '" + kind + "'");
        }
    }

    private static String algorithmText(DnnConvolutionOp<?> conv) {
        Enum<?> algorithm = conv.algorithm();
        if (algorithm instanceof ForwardAlgorithm forward) {
            return forward.text();
        }
        return ((BackwardAlgorithm) algorithm).text();
    }

    private static JsonNode required(ObjectNode state, String field) {
        JsonNode value = state.get(field);
        if (value == null || value.isNull()) {
            throw new ConfigurationException("Stored " + state.path("kind").asText() + " state is missing '"
                    + field + "'");
        }
        return value;
    }

    private static List<Integer> ints(JsonNode array) {
        if (!array.isArray()) {
            throw new ConfigurationException("Expected an array of integers, got " + array);
        }
        List<Integer> values = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            values.add(element.asInt());
        }
        return values;
    }

    private static void putInts(ArrayNode array, List<Integer> values) {
        for (int value : values) {
            array.add(value);
        }
    }
}
