// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.json;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Conversions from Jackson trees to plain immutable Java values, and short
 * descriptions of node kinds for error messages.
 */
public final class JsonValues {

    private JsonValues() {
    }

    /**
     * Copies a JSON object into an immutable map preserving key order.
     *
     * @param node an object node
     * @return map of keys to plain values
     * @throws IllegalArgumentException if {@code node} is not an object
     */
    public static Map<String, Object> toMap(final JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("Expected a JSON object but found " + describe(node));
        }
        final Map<String, Object> out = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> entry = fields.next();
            out.put(entry.getKey(), toValue(entry.getValue()));
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * Copies any JSON value into plain Java values: {@code Map}, {@code List},
     * {@code String}, {@code BigInteger}, {@code BigDecimal}, {@code Boolean} or
     * {@code null}.
     *
     * @param node the node to copy
     * @return the plain value
     */
    public static Object toValue(final JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            return toMap(node);
        }
        if (node.isArray()) {
            final List<Object> out = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                out.add(toValue(element));
            }
            return Collections.unmodifiableList(out);
        }
        if (node.isIntegralNumber()) {
            return node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.asText();
    }

    /**
     * Describes the JSON value kind of a node, for messages such as
     * "expected an integer but found a string".
     *
     * @param node the node, possibly missing
     * @return an article and a kind, e.g. {@code "an array"}
     */
    public static String describe(final JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "nothing";
        }
        return switch (node.getNodeType()) {
            case OBJECT -> "an object";
            case ARRAY -> "an array";
            case STRING -> "a string";
            case BOOLEAN -> "a boolean";
            case NULL -> "null";
            case NUMBER -> node.isIntegralNumber() ? "an integer" : "a decimal number";
            default -> node.getNodeType().name().toLowerCase(Locale.ROOT);
        };
    }
}
