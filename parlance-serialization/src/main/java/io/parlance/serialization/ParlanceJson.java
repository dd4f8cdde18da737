package io.parlance.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/// Shared Jackson setup for everything Parlance reads or writes as JSON.
///
/// ### Usage
/// {@snippet :
/// ObjectMapper mapper = ParlanceJson.createMapper();
/// StructuredValueReader reader = new JacksonStructuredValueReader(mapper);
/// }
///
/// @implNote Thread-safe. A mapper is created per call; callers cache it.
public final class ParlanceJson {

    private ParlanceJson() {}

    /// Creates an ObjectMapper configured for Parlance.
    ///
    /// Registers:
    /// - `JavaTimeModule` for the `Instant` and `Duration` fields of run reports
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled
    /// - Timestamps written as ISO-8601 strings (not numeric)
    /// - Decimals read as `BigDecimal` so configuration numbers keep their digits
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /// Writes an object as pretty-printed JSON.
    ///
    /// @param value the object to write, may be null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Object value) {
        try {
            return createMapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize value: " + e.getMessage(), e);
        }
    }
}
