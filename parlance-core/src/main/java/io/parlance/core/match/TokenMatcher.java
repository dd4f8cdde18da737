package io.parlance.core.match;

import java.util.List;
import java.util.Optional;

/// Recognizes the bracketed shapes of the command language.
///
/// | Shape | Example | Meaning |
/// |-------|---------|---------|
/// | variable | `[name]` | named slot in the variable table |
/// | destructuring | `[{a, b}]` | store properties `a` and `b` of a result |
/// | reference | `{file.txt}` | inline value, re-read on every use |
///
/// Variable names are matched strictly: whitespace at either edge of the name
/// (`[ name ]`) is not a variable.
///
/// Two interchangeable implementations exist and must agree on every input:
/// {@link StringTokenMatcher} and {@link RegexTokenMatcher}.
public interface TokenMatcher {

    /// Returns whether the token is a simple variable such as `[name]`.
    ///
    /// @param token token text, may be null
    /// @return `true` only for the exact `[name]` shape
    boolean isVariable(String token);

    /// Extracts the name from a simple variable token.
    ///
    /// @param token token text, may be null
    /// @return the name without brackets, or empty if the token is not a simple variable
    Optional<String> variableName(String token);

    /// Returns whether the token requests destructuring, such as `[{a, b}]`.
    ///
    /// @param token token text, may be null
    /// @return `true` if at least one property name is listed
    boolean isDestructuring(String token);

    /// Lists the property names of a destructuring token, trimmed, in order.
    ///
    /// @param token token text, may be null
    /// @return property names, never null (empty if the token is not destructuring)
    List<String> destructuredNames(String token);

    /// Returns whether the token is a reference such as `{value}`.
    ///
    /// @param token token text, may be null
    /// @return `true` if the token is wrapped in braces
    boolean isReference(String token);

    /// Strips exactly one outer brace layer from a reference token.
    ///
    /// `{{x}}` yields `{x}`.
    ///
    /// @param token reference token text, not null
    /// @return the payload, or the token unchanged if it is not a reference
    String referencePayload(String token);

    /// Creates the matcher selected by configuration.
    ///
    /// @param useRegex `true` for {@link RegexTokenMatcher}, `false` for {@link StringTokenMatcher}
    /// @return matcher instance, never null
    static TokenMatcher create(boolean useRegex) {
        return useRegex ? new RegexTokenMatcher() : new StringTokenMatcher();
    }
}
