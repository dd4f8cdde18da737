package io.parlance.core.variable;

import io.parlance.core.exception.StructuredValueException;
import io.parlance.core.value.Value;
import java.util.Map;

/// Reads a verb result as named properties for destructuring.
///
/// The core ships {@link MapStructuredValueReader}, which only understands
/// {@link Value.Structured}. The serialization module adds a JSON-aware reader.
@FunctionalInterface
public interface StructuredValueReader {

    /// Extracts the properties of a value.
    ///
    /// @param value verb result, not null
    /// @return property name to value, never null
    /// @throws StructuredValueException if the value has no structured form
    Map<String, Value> read(Value value) throws StructuredValueException;
}
