package io.parlance.core.variable;

import io.parlance.core.exception.StructuredValueException;
import io.parlance.core.value.Value;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// Reads {@link Value.Structured} results and nothing else.
public final class MapStructuredValueReader implements StructuredValueReader {

    @Override
    public Map<String, Value> read(Value value) throws StructuredValueException {
        Objects.requireNonNull(value, "value must not be null");
        if (value instanceof Value.Structured structured) {
            return structured.properties();
        }
        throw new StructuredValueException(
                "Cannot destructure a " + value.getClass().getSimpleName().toLowerCase(Locale.ROOT)
                        + " value: '" + value.asText() + "'");
    }
}
