package io.parlance.core.verb;

import io.parlance.core.exception.VerbExecutionException;
import io.parlance.core.value.Value;
import io.parlance.core.word.Word;
import io.parlance.core.word.WordChain;
import java.util.Optional;
import java.util.Set;

/// Capability contract a verb plugin exposes to the interpreter.
///
/// A verb family (`GET`, `SAY`, ...) may have several implementations that differ
/// in {@link #usage()} and in the {@link Role}s they declare. The dispatcher picks
/// one per sentence by structure alone: which prepositions are present and
/// whether {@link #accepts(Role, Word)} likes the words behind them.
///
/// ### Contracts
/// - **Precondition**: {@link #name()}, {@link #usage()} and {@link #roles()} are
///   constant for the lifetime of the implementation
/// - **Postcondition**: {@link #act(VerbInstance)} returns a non-null value or throws
///
/// @implNote Instances are created through a factory for every dispatch, so
/// implementations may hold per-sentence state, but most are stateless.
///
/// @see VerbModule for registration
/// @see VerbInstance for the resolved arguments handed to {@link #act(VerbInstance)}
public interface Verb {

    /// Canonical verb name, e.g. `GET`. Matched case-insensitively.
    String name();

    /// Usage name distinguishing implementations of one family, e.g. `Text`.
    String usage();

    /// Alternative names for the family, e.g. `ECHO` for `SAY`.
    default Set<String> synonyms() {
        return Set.of();
    }

    /// Roles this implementation fills.
    Set<Role> roles();

    /// Declared roles that may be absent from a sentence.
    default Set<Role> optionalRoles() {
        return Set.of();
    }

    /// Role whose preposition may be omitted, taking the value right after the verb.
    ///
    /// `DELETE {file}.` and `DELETE FROM {file}.` both fill `FROM` when this returns
    /// `FROM`.
    default Optional<Role> implicitRole() {
        return Optional.empty();
    }

    /// Returns whether the direct object names where the result goes rather than an input.
    ///
    /// When `true`, a `[variable]` in direct-object position is not looked up before
    /// acting; it only receives the result.
    default boolean producesWhat() {
        return false;
    }

    /// Preference among implementations of the same family; higher is tried first.
    default int priority() {
        return 0;
    }

    /// Value validator: decides whether a word can fill a role.
    ///
    /// @param role the role being filled, not null
    /// @param word the first word in that role's position, not null
    /// @return `true` if this implementation can take the word
    default boolean accepts(Role role, Word word) {
        return word.isValue();
    }

    /// String resolver: converts literal or reference text to the role's parameter type.
    ///
    /// @param role the role being resolved, not null
    /// @param text literal text or reference payload, not null
    /// @return converted value, or empty if the text is unusable for this role
    default Optional<Value> resolve(Role role, String text) {
        return Optional.of(Value.text(text));
    }

    /// Final structural veto after all roles matched.
    ///
    /// @param sentence the sentence's word chain, not null
    /// @return `true` to accept the sentence
    default boolean canHandle(WordChain sentence) {
        return true;
    }

    /// Performs the action.
    ///
    /// @param instance resolved role values and runtime services, not null
    /// @return the result, never null
    /// @throws VerbExecutionException if the action fails
    Value act(VerbInstance instance) throws VerbExecutionException;
}
