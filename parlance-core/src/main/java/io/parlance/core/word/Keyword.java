package io.parlance.core.word;

import io.parlance.core.verb.Role;
import java.util.Locale;
import java.util.Optional;

/// Reserved words of the command language.
///
/// Every keyword except `THEN` is a preposition that introduces the value of the
/// {@link Role} with the same name. `THEN` chains sentences.
public enum Keyword {
    FROM(Role.FROM, "a source"),
    TO(Role.TO, "a destination"),
    USING(Role.USING, "an argument"),
    WITH(Role.WITH, "an argument"),
    THEN(null, null);

    private final Role role;
    private final String valueDescription;

    Keyword(Role role, String valueDescription) {
        this.role = role;
        this.valueDescription = valueDescription;
    }

    /// Parses a keyword, ignoring case.
    ///
    /// @param text candidate word, may be null
    /// @return the keyword, or empty if the text is not reserved
    public static Optional<Keyword> parse(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(text.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /// Returns the preposition introducing the given role.
    ///
    /// @param role a role other than {@link Role#WHAT}, not null
    /// @return matching keyword, or empty for `WHAT`
    public static Optional<Keyword> forRole(Role role) {
        for (Keyword keyword : values()) {
            if (keyword.role == role) {
                return Optional.of(keyword);
            }
        }
        return Optional.empty();
    }

    /// Returns the role this preposition introduces.
    ///
    /// @return role, or empty for `THEN`
    public Optional<Role> role() {
        return Optional.ofNullable(role);
    }

    public boolean isPreposition() {
        return role != null;
    }

    /// Short noun phrase for messages, e.g. "a source"; null for `THEN`.
    public String valueDescription() {
        return valueDescription;
    }
}
