package io.parlance.core.variable;

import io.parlance.core.match.TokenMatcher;
import io.parlance.core.value.Value;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Default {@link VariableResolver}: a case-insensitive map that keeps the name
/// as first written for display.
///
/// ### Usage
/// {@snippet :
/// VariableTable table = new VariableTable(TokenMatcher.create(false));
/// table.register("Greeting", "hello");
/// table.resolve("[greeting]"); // Text[value=hello]
/// table.resolve("[ greeting ]"); // null
/// }
public final class VariableTable implements VariableResolver {

    private static final Logger logger = Logger.getLogger(VariableTable.class.getName());

    private final TokenMatcher matcher;
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    /// Creates an empty table.
    ///
    /// @param matcher recognizes `[name]` tokens, not null
    public VariableTable(TokenMatcher matcher) {
        this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
    }

    @Override
    public void register(String name, Object value) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Variable name must not be blank");
        }
        String key = key(name);
        Entry previous = entries.get(key);
        String display = previous != null ? previous.name() : name;
        entries.put(key, new Entry(display, Value.of(value)));
        logger.fine(() -> "Variable [" + display + "] set");
    }

    @Override
    public Value resolve(String token) {
        Optional<String> name = matcher.variableName(token);
        if (name.isEmpty()) {
            return null;
        }
        Entry entry = entries.get(key(name.get()));
        return entry == null ? null : entry.value();
    }

    @Override
    public <T> T resolve(String token, Class<T> type) {
        Objects.requireNonNull(type, "type must not be null");
        Value value = resolve(token);
        if (value == null) {
            return null;
        }
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        Object raw = value.raw();
        return type.isInstance(raw) ? type.cast(raw) : null;
    }

    @Override
    public boolean isRegistered(String name) {
        return name != null && entries.containsKey(key(name));
    }

    @Override
    public void clear() {
        entries.clear();
    }

    @Override
    public Set<String> names() {
        Set<String> names = new LinkedHashSet<>();
        entries.values().forEach(e -> names.add(e.name()));
        return Collections.unmodifiableSet(names);
    }

    @Override
    public Map<String, Value> snapshot() {
        Map<String, Value> copy = new LinkedHashMap<>();
        entries.values().forEach(e -> copy.put(e.name(), e.value()));
        return Collections.unmodifiableMap(copy);
    }

    /// Creates an independent table with the same variables.
    ///
    /// @return copy sharing no state with this table, never null
    public VariableTable copy() {
        VariableTable copy = new VariableTable(matcher);
        copy.entries.putAll(entries);
        return copy;
    }

    public int size() {
        return entries.size();
    }

    private static String key(String name) {
        return name.toUpperCase(Locale.ROOT);
    }

    private record Entry(String name, Value value) {}
}
