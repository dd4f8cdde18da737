package io.parlance.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.parlance.core.exception.StructuredValueException;
import io.parlance.core.value.Value;
import io.parlance.core.variable.StructuredValueReader;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// Jackson-based implementation of {@link StructuredValueReader}.
///
/// Reads properties for destructuring from:
/// - a {@link Value.Structured} result, as is
/// - {@link Value.Text} holding a JSON object
/// - {@link Value.Lines} whose lines together form a JSON object, as read by `GET`
///
/// {@snippet :
/// GET [{name, port}] FROM {server.json}.
/// }
///
/// @implNote Thread-safe if the supplied {@link ObjectMapper} is thread-safe.
///
/// @see JsonValues for how JSON values map to {@link Value}s
public class JacksonStructuredValueReader implements StructuredValueReader {

    private final ObjectMapper objectMapper;

    /// Creates a reader backed by the given Jackson mapper.
    ///
    /// @param objectMapper the mapper to parse JSON with, not null
    public JacksonStructuredValueReader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public Map<String, Value> read(Value value) throws StructuredValueException {
        Objects.requireNonNull(value, "value must not be null");
        if (value instanceof Value.Structured structured) {
            return structured.properties();
        }
        if (value instanceof Value.Text || value instanceof Value.Lines) {
            return parse(value.asText());
        }
        throw new StructuredValueException(
                "Cannot destructure '" + value.asText() + "': not a JSON object");
    }

    private Map<String, Value> parse(String json) throws StructuredValueException {
        if (json.isBlank()) {
            throw new StructuredValueException("Cannot destructure an empty value");
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw new StructuredValueException(
                        "Cannot destructure JSON "
                                + (node == null ? "null" : node.getNodeType().name().toLowerCase(Locale.ROOT))
                                + ": an object is required");
            }
            return JsonValues.properties(node);
        } catch (JsonProcessingException e) {
            throw new StructuredValueException(
                    "Failed to parse JSON for destructuring: " + e.getOriginalMessage(), e);
        }
    }
}
