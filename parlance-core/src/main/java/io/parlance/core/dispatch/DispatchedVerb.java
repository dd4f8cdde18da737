package io.parlance.core.dispatch;

import io.parlance.core.verb.Role;
import io.parlance.core.verb.Verb;
import io.parlance.core.verb.VerbDescriptor;
import io.parlance.core.word.Word;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// The implementation chosen for one sentence, with the words filling each role.
///
/// Values are not resolved yet; that happens when the sentence executes, so a
/// variable set by an earlier `THEN` step is visible.
///
/// @param descriptor registry entry of the chosen implementation, not null
/// @param verb fresh instance of the chosen implementation, not null
/// @param roleWords words behind each present role, in sentence order, not null
/// @param qualifier qualifier word that narrowed dispatch, or null
public record DispatchedVerb(
        VerbDescriptor descriptor,
        Verb verb,
        Map<Role, List<Word>> roleWords,
        Word.QualifierWord qualifier) {

    public DispatchedVerb {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(verb, "verb must not be null");
        Objects.requireNonNull(roleWords, "roleWords must not be null");
        Map<Role, List<Word>> copy = new EnumMap<>(Role.class);
        roleWords.forEach((role, words) -> copy.put(role, List.copyOf(words)));
        roleWords = Collections.unmodifiableMap(copy);
    }

    /// Words filling a role.
    ///
    /// @param role role to look up, not null
    /// @return words, empty if the role is absent
    public List<Word> words(Role role) {
        return roleWords.getOrDefault(role, List.of());
    }

    /// Returns the single variable word in the direct-object position, if that is its shape.
    public Optional<Word.VariableWord> whatVariable() {
        List<Word> what = words(Role.WHAT);
        if (what.size() == 1 && what.get(0) instanceof Word.VariableWord variable) {
            return Optional.of(variable);
        }
        return Optional.empty();
    }

    public Optional<Word.QualifierWord> qualifierWord() {
        return Optional.ofNullable(qualifier);
    }

    @Override
    public String toString() {
        return descriptor.id() + roleWords;
    }
}
