package io.parlance.core.verb;

import io.parlance.core.exception.VerbNotFoundException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// Default thread-safe implementation of {@link VerbRegistry}.
///
/// Factories are kept in registration order. The lookup index is an immutable
/// snapshot held in a volatile field and rebuilt lazily after registrations, so
/// concurrent lookups never observe a half-built table.
///
/// ### Usage
/// {@snippet :
/// VerbRegistry registry = new DefaultVerbRegistry();
/// registry.register(SayText::new);
/// registry.refresh();
/// registry.isVerb("echo"); // true
/// }
///
/// @implNote Lookups are lock-free. {@link #refresh()} is synchronized.
///
/// @see VerbRegistry for the contract
/// @see VerbDescriptor#probe(Supplier) for how factories are inspected
public final class DefaultVerbRegistry implements VerbRegistry {

    private static final Logger logger = Logger.getLogger(DefaultVerbRegistry.class.getName());

    private final List<Supplier<? extends Verb>> factories = new CopyOnWriteArrayList<>();

    private volatile Index index = Index.EMPTY;
    private volatile boolean dirty;
    private volatile long version;

    /// Creates an empty registry.
    public DefaultVerbRegistry() {}

    /// Creates a registry populated by the given modules.
    ///
    /// @param modules verb modules to install, not null
    public DefaultVerbRegistry(List<? extends VerbModule> modules) {
        Objects.requireNonNull(modules, "modules must not be null");
        modules.forEach(module -> module.register(this));
    }

    @Override
    public void register(Supplier<? extends Verb> factory) {
        Objects.requireNonNull(factory, "factory must not be null");
        factories.add(factory);
        dirty = true;
    }

    @Override
    public synchronized void refresh() {
        Index rebuilt = probe();
        dirty = false;
        if (rebuilt.fingerprint().equals(index.fingerprint())) {
            logger.fine(() -> "Verb registry unchanged: " + rebuilt.all().size() + " verbs");
            return;
        }
        index = rebuilt;
        version++;
        logger.info(
                "Verb registry indexed "
                        + rebuilt.all().size()
                        + " verb(s) in "
                        + rebuilt.families().size()
                        + " famil"
                        + (rebuilt.families().size() == 1 ? "y" : "ies"));
    }

    @Override
    public synchronized void clear() {
        if (!index.all().isEmpty()) {
            version++;
        }
        index = Index.EMPTY;
        dirty = true;
    }

    @Override
    public boolean isVerb(String name) {
        return name != null && current().families().containsKey(key(name));
    }

    @Override
    public Optional<String> family(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(current().families().get(key(name)));
    }

    @Override
    public List<VerbDescriptor> candidates(String name) {
        Objects.requireNonNull(name, "name must not be null");
        Index snapshot = current();
        String family = snapshot.families().get(key(name));
        if (family == null) {
            return List.of();
        }
        return snapshot.byFamily().getOrDefault(family, List.of());
    }

    @Override
    public VerbDescriptor getOrThrow(String name) throws VerbNotFoundException {
        List<VerbDescriptor> found = candidates(name);
        if (found.isEmpty()) {
            throw new VerbNotFoundException("Unknown verb: '" + name + "'");
        }
        return found.get(0);
    }

    @Override
    public List<VerbDescriptor> all() {
        return current().all();
    }

    @Override
    public Set<String> names() {
        return current().families().keySet();
    }

    @Override
    public long version() {
        current();
        return version;
    }

    private Index current() {
        if (dirty) {
            refresh();
        }
        return index;
    }

    private Index probe() {
        List<VerbDescriptor> probed = new ArrayList<>();
        Set<String> fingerprint = new LinkedHashSet<>();
        for (Supplier<? extends Verb> factory : factories) {
            try {
                Verb sample = factory.get();
                VerbDescriptor descriptor = VerbDescriptor.probe(() -> sample);
                probed.add(descriptor.withFactory(factory));
                fingerprint.add(
                        descriptor.id()
                                + "|"
                                + sample.getClass().getName()
                                + "|"
                                + descriptor.roles()
                                + "|"
                                + descriptor.synonyms());
            } catch (RuntimeException e) {
                logger.warning("Skipping verb that failed to construct: " + e);
            }
        }
        return Index.of(probed, fingerprint);
    }

    private static String key(String name) {
        return name.trim().toUpperCase(Locale.ROOT);
    }

    /// Immutable lookup tables built from one probing pass.
    ///
    /// @param all descriptors in registration order
    /// @param families every name and synonym mapped to its canonical family name
    /// @param byFamily family name to candidates in dispatch order
    /// @param fingerprint identity of the probed plugin set
    private record Index(
            List<VerbDescriptor> all,
            Map<String, String> families,
            Map<String, List<VerbDescriptor>> byFamily,
            Set<String> fingerprint) {

        static final Index EMPTY = new Index(List.of(), Map.of(), Map.of(), Set.of());

        static Index of(List<VerbDescriptor> descriptors, Set<String> fingerprint) {
            Map<String, String> families = new LinkedHashMap<>();
            Map<String, List<VerbDescriptor>> byFamily = new LinkedHashMap<>();

            for (VerbDescriptor descriptor : descriptors) {
                families.putIfAbsent(descriptor.name(), descriptor.name());
                descriptor.synonyms().forEach(s -> families.putIfAbsent(s, descriptor.name()));
                byFamily.computeIfAbsent(descriptor.name(), k -> new ArrayList<>()).add(descriptor);
            }

            // stable sort keeps registration order among equal priorities
            Map<String, List<VerbDescriptor>> ordered = new LinkedHashMap<>();
            byFamily.forEach(
                    (family, list) -> {
                        List<VerbDescriptor> sorted = new ArrayList<>(list);
                        sorted.sort(
                                Comparator.comparingInt(VerbDescriptor::priority).reversed());
                        ordered.put(family, List.copyOf(sorted));
                    });

            return new Index(
                    List.copyOf(descriptors),
                    Collections.unmodifiableMap(families),
                    Collections.unmodifiableMap(ordered),
                    Collections.unmodifiableSet(new LinkedHashSet<>(fingerprint)));
        }
    }
}
