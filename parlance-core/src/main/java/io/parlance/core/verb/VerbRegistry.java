package io.parlance.core.verb;

import io.parlance.core.exception.VerbNotFoundException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/// Central table of verb implementations, built once at startup.
///
/// Plugins register factories; the registry probes each factory once to learn
/// the verb's names, usage and role signature, then indexes them by every name
/// and synonym (case-insensitive).
///
/// ### Contracts
/// - **Invariant**: lookups see a consistent snapshot; a refresh swaps the whole index
/// - **Postcondition**: {@link #candidates(String)} is ordered by descending priority,
///   then registration order
///
/// @implNote Implementations should be safe for concurrent lookups. Refreshes
/// must not race a dispatch on the same registry; hosts serialize them.
///
/// @see DefaultVerbRegistry
/// @see VerbModule
public interface VerbRegistry {

    /// Registers a verb factory. Probing is deferred to the next lookup or {@link #refresh()}.
    ///
    /// @apiNote **Side effects**: marks the index stale
    ///
    /// @param factory verb factory, not null
    /// @throws NullPointerException if factory is null
    void register(Supplier<? extends Verb> factory);

    /// Re-probes all registered factories.
    ///
    /// The index and {@link #version()} only change when the resulting set of
    /// implementations differs from the current one. Factories that throw while
    /// constructing are skipped.
    void refresh();

    /// Drops the cached index so the next lookup probes again.
    void clear();

    /// Returns whether the text names a known verb or synonym.
    ///
    /// @param name candidate verb text, may be null
    /// @return `true` if registered
    boolean isVerb(String name);

    /// Maps a verb name or synonym to its canonical family name.
    ///
    /// @param name verb text, not null
    /// @return canonical name, or empty if unknown
    Optional<String> family(String name);

    /// Returns every implementation of the family the name belongs to.
    ///
    /// @param name verb text or synonym, not null
    /// @return ordered candidates, never null (empty if unknown)
    List<VerbDescriptor> candidates(String name);

    /// Returns the preferred implementation of a verb.
    ///
    /// @param name verb text or synonym, not null
    /// @return highest-priority descriptor, never null
    /// @throws VerbNotFoundException if no verb has that name
    VerbDescriptor getOrThrow(String name) throws VerbNotFoundException;

    /// Returns all probed implementations.
    ///
    /// @return unmodifiable list, never null
    List<VerbDescriptor> all();

    /// Returns every recognized verb name and synonym, upper case.
    ///
    /// @return unmodifiable set, never null
    Set<String> names();

    /// Returns the number of probed implementations.
    default int size() {
        return all().size();
    }

    /// Returns a counter that increases whenever the index content changes.
    long version();
}
