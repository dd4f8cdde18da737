package io.parlance.core.variable;

import io.parlance.core.value.Value;
import java.util.Map;
import java.util.Set;

/// Name-to-value table that sentences read from and store results into.
///
/// Names compare case-insensitively. Lookups take the token as written,
/// `[name]`, and succeed only for that exact shape: `[ name ]` never resolves.
///
/// ### Contracts
/// - **Invariant**: at most one entry per name under case-insensitive comparison
/// - **Postcondition**: {@link #resolve(String)} never throws for any input
///
/// @implNote Owned by one execution context. **Not thread-safe**.
///
/// @see VariableTable
public interface VariableResolver {

    /// Stores a value, replacing any previous value under the same name.
    ///
    /// @param name variable name without brackets, not null or blank
    /// @param value value to store, not null; plain Java objects are converted with {@link Value#of(Object)}
    /// @throws NullPointerException if name or value is null
    /// @throws IllegalArgumentException if name is blank
    void register(String name, Object value);

    /// Looks up a variable token.
    ///
    /// @param token token text such as `[name]`, may be null
    /// @return stored value, or null if the token is malformed or unset
    Value resolve(String token);

    /// Looks up a variable token and checks its type.
    ///
    /// Matches either the stored {@link Value} variant itself or its raw Java object.
    ///
    /// @param token token text such as `[name]`, may be null
    /// @param type expected type, not null
    /// @return value of that type, or null if unset or of another type
    <T> T resolve(String token, Class<T> type);

    /// Returns whether a bare name is registered.
    ///
    /// @param name variable name without brackets, may be null
    boolean isRegistered(String name);

    /// Removes all variables.
    void clear();

    /// Returns the stored names as first registered.
    Set<String> names();

    /// Returns a copy of all variables keyed by display name.
    Map<String, Value> snapshot();
}
