package io.parlance.core.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/// Closed set of values that flow between sentences, variables and verbs.
///
/// Verbs receive their resolved role values and return their results as one of
/// these variants, so callers branch with `instanceof` instead of casting raw
/// objects.
///
/// | Variant | Carries | `asText()` |
/// |---------|---------|------------|
/// | {@link Text} | a string | the string |
/// | {@link Numeric} | a number | integral values without a fraction |
/// | {@link Bool} | a boolean | `true` / `false` |
/// | {@link Lines} | ordered lines | lines joined by `\n` |
/// | {@link Structured} | named properties | `{name=value, ...}` |
/// | {@link Handle} | an opaque object (path, URI, charset) | `toString()` |
public sealed interface Value
        permits Value.Text, Value.Numeric, Value.Bool, Value.Lines, Value.Structured, Value.Handle {

    /// Returns the plain Java object behind this value.
    ///
    /// @return unwrapped value, never null
    Object raw();

    /// Renders this value as text.
    ///
    /// @return textual form, never null
    String asText();

    /// Wraps a string.
    ///
    /// @param text the text, not null
    /// @return text value, never null
    static Value text(String text) {
        return new Text(text);
    }

    /// Wraps a list of lines.
    ///
    /// @param lines the lines, not null
    /// @return lines value, never null
    static Value lines(List<String> lines) {
        return new Lines(lines);
    }

    /// Converts an arbitrary Java object into the closest variant.
    ///
    /// `null` becomes empty text, strings become {@link Text}, numbers become
    /// {@link Numeric}, booleans become {@link Bool}, collections and string arrays
    /// become {@link Lines}, maps become {@link Structured}. Anything else is wrapped
    /// as a {@link Handle}.
    ///
    /// @param object the object to convert, may be null
    /// @return converted value, never null
    static Value of(Object object) {
        if (object == null) {
            return new Text("");
        }
        if (object instanceof Value value) {
            return value;
        }
        if (object instanceof String s) {
            return new Text(s);
        }
        if (object instanceof Number n) {
            return new Numeric(n);
        }
        if (object instanceof Boolean b) {
            return new Bool(b);
        }
        if (object instanceof String[] array) {
            return new Lines(List.of(array));
        }
        if (object instanceof Collection<?> collection) {
            return new Lines(
                    collection.stream().map(e -> Value.of(e).asText()).collect(Collectors.toList()));
        }
        if (object instanceof Map<?, ?> map) {
            Map<String, Value> properties = new LinkedHashMap<>();
            map.forEach((k, v) -> properties.put(String.valueOf(k), Value.of(v)));
            return new Structured(properties);
        }
        return new Handle(object);
    }

    /// Plain text.
    ///
    /// @param value the text, not null
    record Text(String value) implements Value {
        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Object raw() {
            return value;
        }

        @Override
        public String asText() {
            return value;
        }
    }

    /// A number, integral or decimal.
    ///
    /// @param value the number, not null
    record Numeric(Number value) implements Value {
        public Numeric {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Object raw() {
            return value;
        }

        @Override
        public String asText() {
            if (value instanceof Double || value instanceof Float) {
                double d = value.doubleValue();
                if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                    return String.valueOf((long) d);
                }
                return String.valueOf(d);
            }
            if (value instanceof BigDecimal decimal) {
                return decimal.stripTrailingZeros().toPlainString();
            }
            if (value instanceof BigInteger integer) {
                return integer.toString();
            }
            return String.valueOf(value);
        }
    }

    /// A boolean flag.
    record Bool(boolean value) implements Value {
        @Override
        public Object raw() {
            return value;
        }

        @Override
        public String asText() {
            return String.valueOf(value);
        }
    }

    /// Ordered lines, as produced by text-reading verbs.
    ///
    /// @param lines the lines, not null, copied
    record Lines(List<String> lines) implements Value {
        public Lines {
            lines = List.copyOf(lines);
        }

        @Override
        public Object raw() {
            return lines;
        }

        @Override
        public String asText() {
            return String.join("\n", lines);
        }
    }

    /// Named properties, the shape destructuring reads from.
    ///
    /// @param properties property name to value, not null, insertion order kept
    record Structured(Map<String, Value> properties) implements Value {
        public Structured {
            properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        }

        /// Looks a property up, ignoring case.
        ///
        /// @param name property name, not null
        /// @return the property value, or empty if absent
        public Optional<Value> get(String name) {
            Objects.requireNonNull(name, "name must not be null");
            Value exact = properties.get(name);
            if (exact != null) {
                return Optional.of(exact);
            }
            return properties.entrySet().stream()
                    .filter(e -> e.getKey().equalsIgnoreCase(name))
                    .map(Map.Entry::getValue)
                    .findFirst();
        }

        @Override
        public Object raw() {
            Map<String, Object> raw = new LinkedHashMap<>();
            properties.forEach((k, v) -> raw.put(k, v.raw()));
            return raw;
        }

        @Override
        public String asText() {
            return properties.entrySet().stream()
                    .map(e -> e.getKey() + "=" + e.getValue().asText())
                    .collect(Collectors.joining(", ", "{", "}"));
        }
    }

    /// Opaque object resolved by a verb, such as a `Path`, `URI` or `Charset`.
    ///
    /// @param object the wrapped object, not null
    record Handle(Object object) implements Value {
        public Handle {
            Objects.requireNonNull(object, "object must not be null");
        }

        @Override
        public Object raw() {
            return object;
        }

        @Override
        public String asText() {
            return object.toString();
        }
    }
}
