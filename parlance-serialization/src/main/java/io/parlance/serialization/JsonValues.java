package io.parlance.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import io.parlance.core.value.Value;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Conversions between Jackson trees and {@link Value}s.
///
/// | JSON | Value |
/// |------|-------|
/// | string | {@link Value.Text} |
/// | integral or decimal number | {@link Value.Numeric} |
/// | boolean | {@link Value.Bool} |
/// | null | empty {@link Value.Text} |
/// | array | {@link Value.Lines}, each element as text |
/// | object | {@link Value.Structured} |
public final class JsonValues {

    private JsonValues() {}

    /// Converts a JSON node.
    ///
    /// @param node node to convert, may be null
    /// @return converted value, never null
    public static Value toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Value.text("");
        }
        if (node.isTextual()) {
            return Value.text(node.textValue());
        }
        if (node.isNumber()) {
            return new Value.Numeric(node.numberValue());
        }
        if (node.isBoolean()) {
            return new Value.Bool(node.booleanValue());
        }
        if (node.isArray()) {
            List<String> lines = new ArrayList<>(node.size());
            node.forEach(element -> lines.add(toValue(element).asText()));
            return Value.lines(lines);
        }
        if (node.isObject()) {
            return new Value.Structured(properties(node));
        }
        return Value.text(node.asText());
    }

    /// Converts the fields of a JSON object.
    ///
    /// @param node object node, not null
    /// @return field name to value in document order, never null
    public static Map<String, Value> properties(JsonNode node) {
        Map<String, Value> properties = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            properties.put(field.getKey(), toValue(field.getValue()));
        }
        return properties;
    }

    /// Converts a value to plain Java objects Jackson can write.
    ///
    /// Handles are written as their text form.
    ///
    /// @param value value to convert, may be null
    /// @return JSON-friendly object, or null for null
    public static Object toPlain(Value value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Value.Structured structured) {
            Map<String, Object> map = new LinkedHashMap<>();
            structured.properties().forEach((k, v) -> map.put(k, toPlain(v)));
            return map;
        }
        if (value instanceof Value.Handle handle) {
            return handle.asText();
        }
        return value.raw();
    }
}
