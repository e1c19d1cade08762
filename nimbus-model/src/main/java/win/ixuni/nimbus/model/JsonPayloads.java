package win.ixuni.nimbus.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * JSON payload access shared by the result models
 * <p>
 * A key counts as present only when it exists and is not JSON {@code null}.
 */
public final class JsonPayloads {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonPayloads() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * @throws ModelParseException on malformed JSON
     */
    public static JsonNode parse(String json) {
        if (json == null) {
            throw new ModelParseException("Payload is null");
        }
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ModelParseException("Malformed JSON payload: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @throws ModelParseException when the node is not a JSON object
     */
    public static JsonNode requireObject(JsonNode node, String model) {
        if (node == null || !node.isObject()) {
            throw new ModelParseException(model + " expects a JSON object but got "
                    + (node == null ? "nothing" : node.getNodeType()));
        }
        return node;
    }

    public static boolean exists(JsonNode object, String key) {
        JsonNode value = object.get(key);
        return value != null && !value.isNull();
    }

    public static void ifString(JsonNode object, String key, Consumer<String> setter) {
        if (exists(object, key)) {
            setter.accept(object.get(key).asText());
        }
    }

    public static void ifLong(JsonNode object, String key, Consumer<Long> setter) {
        if (exists(object, key)) {
            JsonNode value = object.get(key);
            if (!value.canConvertToLong() && !value.isTextual()) {
                throw new ModelParseException("Field '" + key + "' is not an integer: " + value);
            }
            setter.accept(value.isTextual() ? parseLong(key, value.asText()) : value.asLong());
        }
    }

    public static <T> void ifObject(JsonNode object, String key, Function<JsonNode, T> converter, Consumer<T> setter) {
        if (exists(object, key)) {
            setter.accept(converter.apply(requireObject(object.get(key), "Field '" + key + "'")));
        }
    }

    /**
     * Convert each element of an array field, in order
     */
    public static <T> void forEachObject(JsonNode object, String key, Function<JsonNode, T> converter, Consumer<T> sink) {
        if (!exists(object, key)) {
            return;
        }
        JsonNode array = object.get(key);
        if (!array.isArray()) {
            throw new ModelParseException("Field '" + key + "' expects a JSON array but got " + array.getNodeType());
        }
        for (JsonNode element : array) {
            sink.accept(converter.apply(requireObject(element, "Element of '" + key + "'")));
        }
    }

    private static long parseLong(String key, String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new ModelParseException("Field '" + key + "' is not an integer: " + text, e);
        }
    }
}
