package io.parlance.core.lexicon;

import io.parlance.core.verb.VerbDescriptor;
import java.util.Objects;

/// One concrete usage of a verb family, e.g. `GET` used as `Text`.
///
/// @param family canonical family name, not null
/// @param usage usage name as declared by the verb, not null
/// @param descriptor registry entry behind this usage, not null
public record VerbUsage(String family, String usage, VerbDescriptor descriptor) {

    public VerbUsage {
        Objects.requireNonNull(family, "family must not be null");
        Objects.requireNonNull(usage, "usage must not be null");
        Objects.requireNonNull(descriptor, "descriptor must not be null");
    }

    /// Returns whether the text names this usage, ignoring case.
    public boolean matches(String text) {
        return usage.equalsIgnoreCase(text);
    }
}
