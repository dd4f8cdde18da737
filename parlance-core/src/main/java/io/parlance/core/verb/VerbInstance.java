package io.parlance.core.verb;

import io.parlance.core.exception.VerbExecutionException;
import io.parlance.core.value.Value;
import java.net.URI;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// A dispatched verb bound to its resolved role values.
///
/// Handed to {@link Verb#act(VerbInstance)}. The typed accessors convert the
/// common value shapes so actions stay short.
///
/// @implNote Immutable. One instance is created per executed sentence.
public final class VerbInstance {

    private final VerbDescriptor descriptor;
    private final Verb verb;
    private final Map<Role, Value> values;
    private final VerbServices services;
    private final CancellationToken cancellation;

    /// Creates a bound verb.
    ///
    /// @param descriptor registry entry of the verb, not null
    /// @param verb the verb implementation chosen by dispatch, not null
    /// @param values resolved role values, not null (roles absent from the sentence are missing)
    /// @param services runtime services, not null
    /// @param cancellation caller's cancellation token, not null
    public VerbInstance(
            VerbDescriptor descriptor,
            Verb verb,
            Map<Role, Value> values,
            VerbServices services,
            CancellationToken cancellation) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor must not be null");
        this.verb = Objects.requireNonNull(verb, "verb must not be null");
        Objects.requireNonNull(values, "values must not be null");
        this.values =
                values.isEmpty()
                        ? Collections.emptyMap()
                        : Collections.unmodifiableMap(new EnumMap<>(values));
        this.services = Objects.requireNonNull(services, "services must not be null");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation must not be null");
    }

    /// Runs the bound verb.
    ///
    /// @return the action's result, never null
    /// @throws VerbExecutionException if the action fails or returns null
    public Value invoke() throws VerbExecutionException {
        Value result = verb.act(this);
        if (result == null) {
            throw new VerbExecutionException(descriptor.id() + " produced no result");
        }
        return result;
    }

    public VerbDescriptor descriptor() {
        return descriptor;
    }

    public VerbServices services() {
        return services;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    /// Returns all resolved role values.
    ///
    /// @return unmodifiable map, never null
    public Map<Role, Value> values() {
        return values;
    }

    /// Returns the resolved value of a role.
    ///
    /// @param role role to look up, not null
    /// @return value, or empty if the role was not present in the sentence
    public Optional<Value> value(Role role) {
        return Optional.ofNullable(values.get(role));
    }

    /// Returns a role's value as text.
    ///
    /// @param role role to look up, not null
    /// @return text form, never null
    /// @throws VerbExecutionException if the role has no value
    public String text(Role role) throws VerbExecutionException {
        return require(role).asText();
    }

    /// Returns a role's value as a file path resolved against the working directory.
    ///
    /// @param role role to look up, not null
    /// @return resolved path, never null
    /// @throws VerbExecutionException if the role has no value or is not a valid path
    public Path path(Role role) throws VerbExecutionException {
        Value value = require(role);
        if (value instanceof Value.Handle handle && handle.object() instanceof Path path) {
            return services.resolve(path);
        }
        try {
            return services.resolve(Path.of(value.asText()));
        } catch (InvalidPathException e) {
            throw new VerbExecutionException("Invalid path: " + value.asText(), e);
        }
    }

    /// Returns a role's value as a URI.
    ///
    /// @param role role to look up, not null
    /// @return URI, never null
    /// @throws VerbExecutionException if the role has no value or is not a valid URI
    public URI uri(Role role) throws VerbExecutionException {
        Value value = require(role);
        if (value instanceof Value.Handle handle && handle.object() instanceof URI uri) {
            return uri;
        }
        try {
            return URI.create(value.asText());
        } catch (IllegalArgumentException e) {
            throw new VerbExecutionException("Invalid URI: " + value.asText(), e);
        }
    }

    /// Returns a role's value as a handle of the given type.
    ///
    /// @param role role to look up, not null
    /// @param type expected handle type, not null
    /// @return the wrapped object, never null
    /// @throws VerbExecutionException if the role has no value or holds something else
    public <T> T handle(Role role, Class<T> type) throws VerbExecutionException {
        Value value = require(role);
        if (value instanceof Value.Handle handle && type.isInstance(handle.object())) {
            return type.cast(handle.object());
        }
        throw new VerbExecutionException(
                descriptor.id() + " expected " + type.getSimpleName() + " for " + role
                        + " but got '" + value.asText() + "'");
    }

    private Value require(Role role) throws VerbExecutionException {
        Value value = values.get(role);
        if (value == null) {
            throw new VerbExecutionException(descriptor.id() + " has no value for " + role);
        }
        return value;
    }

    @Override
    public String toString() {
        return descriptor.id() + values;
    }
}
