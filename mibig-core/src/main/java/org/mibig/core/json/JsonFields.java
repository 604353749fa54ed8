package org.mibig.core.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Field access helpers for decoding and encoding entities as Jackson trees.
 *
 * <p>Readers take the dotted path of the enclosing entity so that structural problems (a
 * missing required field, a node of the wrong type) are reported as a
 * {@link ValidationException} naming the field. Optional readers return {@code null} or an
 * empty list for absent and JSON-null fields.
 *
 * <p>Writers omit unset optional values entirely instead of emitting JSON null.
 */
public final class JsonFields {

    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

    private JsonFields() {
        // Utility class
    }

    // ==================== Readers ====================

    /**
     * Ensures a node is a JSON object.
     *
     * @param node node to check
     * @param path entity path for error reporting
     * @return the node
     */
    public static JsonNode object(JsonNode node, String path) {
        if (node == null || !node.isObject()) {
            throw ValidationException.of(path, "expected a JSON object");
        }
        return node;
    }

    public static boolean has(JsonNode node, String field) {
        JsonNode child = node.get(field);
        return child != null && !child.isNull();
    }

    /**
     * Extracts a required child node.
     */
    public static JsonNode required(JsonNode node, String field, String path) {
        JsonNode child = node.get(field);
        if (child == null || child.isNull()) {
            throw ValidationException.of(path + "." + field, "missing required field");
        }
        return child;
    }

    public static String text(JsonNode node, String field, String path) {
        JsonNode child = required(node, field, path);
        if (!child.isTextual()) {
            throw ValidationException.of(path + "." + field, "expected a string");
        }
        return child.asText();
    }

    public static String optionalText(JsonNode node, String field, String path) {
        return has(node, field) ? text(node, field, path) : null;
    }

    public static int integer(JsonNode node, String field, String path) {
        JsonNode child = required(node, field, path);
        if (!child.canConvertToInt() || !child.isIntegralNumber()) {
            throw ValidationException.of(path + "." + field, "expected an integer");
        }
        return child.asInt();
    }

    public static Integer optionalInteger(JsonNode node, String field, String path) {
        return has(node, field) ? integer(node, field, path) : null;
    }

    public static Double optionalDouble(JsonNode node, String field, String path) {
        if (!has(node, field)) {
            return null;
        }
        JsonNode child = node.get(field);
        if (!child.isNumber()) {
            throw ValidationException.of(path + "." + field, "expected a number");
        }
        return child.asDouble();
    }

    public static boolean bool(JsonNode node, String field, String path) {
        JsonNode child = required(node, field, path);
        if (!child.isBoolean()) {
            throw ValidationException.of(path + "." + field, "expected a boolean");
        }
        return child.asBoolean();
    }

    public static Boolean optionalBool(JsonNode node, String field, String path) {
        return has(node, field) ? bool(node, field, path) : null;
    }

    /**
     * Decodes every element of an optional array field.
     *
     * @param node parent node
     * @param field array field name
     * @param path entity path for error reporting
     * @param reader element decoder
     * @param <T> element type
     * @return decoded elements, empty when the field is absent
     */
    public static <T> List<T> list(JsonNode node, String field, String path, Function<JsonNode, T> reader) {
        if (!has(node, field)) {
            return List.of();
        }
        return elements(node.get(field), path + "." + field, reader);
    }

    /**
     * Decodes every element of a required array field.
     */
    public static <T> List<T> requiredList(JsonNode node, String field, String path, Function<JsonNode, T> reader) {
        return elements(required(node, field, path), path + "." + field, reader);
    }

    /**
     * Reads an ISO-8601 calendar date such as {@code 2024-03-07}.
     */
    public static LocalDate date(JsonNode node, String field, String path) {
        String text = text(node, field, path);
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw ValidationException.of(path + "." + field, "Invalid date '" + text + "'");
        }
    }

    public static LocalDate optionalDate(JsonNode node, String field, String path) {
        return has(node, field) ? date(node, field, path) : null;
    }

    public static List<String> textList(JsonNode node, String field, String path) {
        return list(node, field, path, element -> {
            if (!element.isTextual()) {
                throw ValidationException.of(path + "." + field, "expected a list of strings");
            }
            return element.asText();
        });
    }

    private static <T> List<T> elements(JsonNode array, String path, Function<JsonNode, T> reader) {
        if (!array.isArray()) {
            throw ValidationException.of(path, "expected a JSON array");
        }
        List<T> result = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            result.add(reader.apply(element));
        }
        return result;
    }

    /**
     * Reads a string-valued node, used by scalar entities encoded as plain JSON strings.
     */
    public static String asText(JsonNode node, String path) {
        if (node == null || !node.isTextual()) {
            throw ValidationException.of(path, "expected a string");
        }
        return node.asText();
    }

    // ==================== Writers ====================

    public static ObjectNode newObject() {
        return FACTORY.objectNode();
    }

    public static JsonNode textNode(String value) {
        return FACTORY.textNode(value);
    }

    public static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    public static void putIfPresent(ObjectNode node, String field, Integer value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    public static void putIfPresent(ObjectNode node, String field, Double value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    public static void putIfPresent(ObjectNode node, String field, Boolean value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    public static void putIfPresent(ObjectNode node, String field, JsonNode value) {
        if (value != null) {
            node.set(field, value);
        }
    }

    /**
     * Writes a list as a JSON array, even when empty.
     */
    public static <T> ArrayNode putList(ObjectNode node, String field, Collection<T> values, Function<T, JsonNode> writer) {
        ArrayNode array = node.putArray(field);
        for (T value : values) {
            array.add(writer.apply(value));
        }
        return array;
    }

    /**
     * Writes a list as a JSON array only when it has elements.
     */
    public static <T> void putListIfNotEmpty(ObjectNode node, String field, Collection<T> values, Function<T, JsonNode> writer) {
        if (values != null && !values.isEmpty()) {
            putList(node, field, values, writer);
        }
    }

    public static void putTextList(ObjectNode node, String field, Collection<String> values) {
        putList(node, field, values, FACTORY::textNode);
    }

    public static void putTextListIfNotEmpty(ObjectNode node, String field, Collection<String> values) {
        putListIfNotEmpty(node, field, values, FACTORY::textNode);
    }

    /**
     * Copies every field of {@code source} into {@code target}, used to flatten variant payloads
     * into their tagged container.
     */
    public static void merge(ObjectNode target, ObjectNode source) {
        source.fields().forEachRemaining(entry -> target.set(entry.getKey(), entry.getValue()));
    }
}
