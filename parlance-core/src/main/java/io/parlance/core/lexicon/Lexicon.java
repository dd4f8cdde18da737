package io.parlance.core.lexicon;

import io.parlance.core.verb.Role;
import io.parlance.core.verb.VerbDescriptor;
import io.parlance.core.verb.VerbRegistry;
import io.parlance.core.word.Keyword;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Read-through cache of what each verb family can be used for.
///
/// Answers the questions the word factory and validator ask: which usages a
/// verb has, which prepositions may follow it and whether it takes a direct
/// object. Entries are computed from the {@link VerbRegistry} on first use and
/// dropped whenever the registry's {@link VerbRegistry#version()} moves.
///
/// @implNote Thread-safe.
public final class Lexicon {

    private static final Logger logger = Logger.getLogger(Lexicon.class.getName());

    private final VerbRegistry registry;
    private final Map<String, List<VerbUsage>> usages = new ConcurrentHashMap<>();
    private volatile long seenVersion = -1;

    /// Creates a lexicon over a registry.
    ///
    /// @param registry verb registry, not null
    public Lexicon(VerbRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public VerbRegistry registry() {
        return registry;
    }

    /// Lists the usages of the family a verb name belongs to.
    ///
    /// @param verb verb name or synonym, not null
    /// @return usages in dispatch order, empty if the verb is unknown
    public List<VerbUsage> usages(String verb) {
        Objects.requireNonNull(verb, "verb must not be null");
        sync();
        Optional<String> family = registry.family(verb);
        if (family.isEmpty()) {
            return List.of();
        }
        return usages.computeIfAbsent(family.get(), this::load);
    }

    /// Lists the usage names of a verb, e.g. `[Text, Config]` for `LOAD`.
    public List<String> usageNames(String verb) {
        return usages(verb).stream().map(VerbUsage::usage).distinct().toList();
    }

    /// Finds a usage by name, ignoring case.
    ///
    /// @param verb verb name or synonym, not null
    /// @param usage usage name, not null
    /// @return the first matching usage, or empty
    public Optional<VerbUsage> findUsage(String verb, String usage) {
        Objects.requireNonNull(usage, "usage must not be null");
        return usages(verb).stream().filter(u -> u.matches(usage)).findFirst();
    }

    /// Returns whether the text is a usage name of the verb.
    public boolean isUsage(String verb, String text) {
        return text != null && findUsage(verb, text).isPresent();
    }

    /// Prepositions legal after a verb across all of its usages.
    ///
    /// @param verb verb name or synonym, not null
    /// @return prepositions in keyword order, never null
    public Set<Keyword> prepositions(String verb) {
        Set<Keyword> keywords = EnumSet.noneOf(Keyword.class);
        for (VerbUsage usage : usages(verb)) {
            usage.descriptor().roles().forEach(role -> Keyword.forRole(role).ifPresent(keywords::add));
        }
        return keywords;
    }

    /// Returns whether any usage of the verb takes a value right after the verb.
    ///
    /// True when a usage declares {@link Role#WHAT} or has an implicit role.
    public boolean acceptsDirectObject(String verb) {
        return usages(verb).stream()
                .map(VerbUsage::descriptor)
                .anyMatch(d -> d.declares(Role.WHAT) || d.implicitRole() != null);
    }

    /// Canonical family names, in registration order.
    public Set<String> families() {
        Set<String> families = new LinkedHashSet<>();
        registry.all().forEach(d -> families.add(d.name()));
        return families;
    }

    /// Drops every cached entry.
    public void invalidate() {
        usages.clear();
        logger.fine("Lexicon cache invalidated");
    }

    private void sync() {
        long version = registry.version();
        if (version != seenVersion) {
            invalidate();
            seenVersion = version;
        }
    }

    private List<VerbUsage> load(String family) {
        List<VerbUsage> loaded = new ArrayList<>();
        for (VerbDescriptor descriptor : registry.candidates(family)) {
            loaded.add(new VerbUsage(family, descriptor.usage(), descriptor));
        }
        logger.fine(
                () ->
                        "Lexicon loaded "
                                + family.toUpperCase(Locale.ROOT)
                                + " -> "
                                + loaded.stream().map(VerbUsage::usage).toList());
        return List.copyOf(loaded);
    }
}
