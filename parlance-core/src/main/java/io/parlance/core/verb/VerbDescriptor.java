package io.parlance.core.verb;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/// Registry entry for one verb implementation, captured by probing its factory once.
///
/// @param name canonical family name, upper case
/// @param usage usage name, e.g. `Text`
/// @param synonyms alternative family names, upper case
/// @param roles declared roles
/// @param optionalRoles declared roles that may be absent
/// @param implicitRole role whose preposition may be omitted, or null
/// @param producesWhat whether the direct object is an output slot
/// @param priority dispatch preference within the family
/// @param factory creates fresh instances for dispatch
public record VerbDescriptor(
        String name,
        String usage,
        Set<String> synonyms,
        Set<Role> roles,
        Set<Role> optionalRoles,
        Role implicitRole,
        boolean producesWhat,
        int priority,
        Supplier<? extends Verb> factory) {

    public VerbDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(usage, "usage must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        synonyms = Set.copyOf(synonyms);
        roles = Set.copyOf(roles);
        optionalRoles = Set.copyOf(optionalRoles);
    }

    /// Builds a descriptor by constructing one instance and reading its metadata.
    ///
    /// @param factory verb factory, not null
    /// @return descriptor, never null
    /// @throws IllegalArgumentException if the verb declares no name, usage or roles
    /// @throws RuntimeException whatever the factory throws while constructing
    public static VerbDescriptor probe(Supplier<? extends Verb> factory) {
        Objects.requireNonNull(factory, "factory must not be null");
        Verb verb = Objects.requireNonNull(factory.get(), "verb factory returned null");

        String name = verb.name();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(
                    "Verb " + verb.getClass().getName() + " declares no name");
        }
        if (verb.usage() == null || verb.usage().isBlank()) {
            throw new IllegalArgumentException("Verb " + name + " declares no usage");
        }
        if (verb.roles() == null || verb.roles().isEmpty()) {
            throw new IllegalArgumentException("Verb " + name + " declares no roles");
        }

        Set<String> synonyms = new LinkedHashSet<>();
        verb.synonyms().forEach(s -> synonyms.add(s.toUpperCase(Locale.ROOT)));

        Set<Role> optional = EnumSet.noneOf(Role.class);
        verb.optionalRoles().stream().filter(verb.roles()::contains).forEach(optional::add);

        return new VerbDescriptor(
                name.toUpperCase(Locale.ROOT),
                verb.usage(),
                synonyms,
                verb.roles(),
                optional,
                verb.implicitRole().filter(verb.roles()::contains).orElse(null),
                verb.producesWhat(),
                verb.priority(),
                factory);
    }

    /// Returns a copy that creates instances through another factory.
    VerbDescriptor withFactory(Supplier<? extends Verb> other) {
        return new VerbDescriptor(
                name, usage, synonyms, roles, optionalRoles, implicitRole, producesWhat, priority,
                other);
    }

    /// Identifier such as `GET TEXT`.
    public String id() {
        return name + " " + usage.toUpperCase(Locale.ROOT);
    }

    /// Number of values the verb is constructed with.
    public int arity() {
        return roles.size();
    }

    public boolean declares(Role role) {
        return roles.contains(role);
    }

    public boolean isOptional(Role role) {
        return optionalRoles.contains(role);
    }

    /// Creates a fresh instance for one dispatch.
    public Verb newInstance() {
        return factory.get();
    }
}
