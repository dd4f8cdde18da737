package io.parlance.cli.ui;

import io.parlance.core.lexicon.Lexicon;
import io.parlance.core.lexicon.VerbUsage;
import io.parlance.core.verb.Role;
import io.parlance.core.verb.VerbDescriptor;
import io.parlance.core.word.Keyword;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/// Prints the verbs known to a {@link Lexicon}, one block per family.
///
/// ```
/// GET  (prepositions: FROM)
///   • TEXT     GET [what] FROM source
/// DELETE  (prepositions: FROM)
///   • FILE     DELETE [FROM] source
/// ```
public final class VerbCatalogPrinter {

    private final Lexicon lexicon;
    private final AnsiStyles styles;

    public VerbCatalogPrinter(Lexicon lexicon, AnsiStyles styles) {
        this.lexicon = Objects.requireNonNull(lexicon, "lexicon must not be null");
        this.styles = Objects.requireNonNull(styles, "styles must not be null");
    }

    /// Prints every family in alphabetical order.
    ///
    /// @param out destination, not null
    /// @return number of usages printed
    public int print(PrintStream out) {
        int printed = 0;
        for (String family : new TreeSet<>(lexicon.families())) {
            List<VerbUsage> usages = lexicon.usages(family);
            Set<Keyword> prepositions = lexicon.prepositions(family);

            StringBuilder header = new StringBuilder(styles.verb(family));
            if (!prepositions.isEmpty()) {
                header.append(
                        styles.dim(
                                "  (prepositions: "
                                        + prepositions.stream()
                                                .map(Keyword::name)
                                                .collect(Collectors.joining(", "))
                                        + ")"));
            }
            out.println(header);

            for (VerbUsage usage : usages) {
                VerbDescriptor descriptor = usage.descriptor();
                out.printf(
                        "  %s %-10s %s%s%n",
                        styles.bullet(),
                        usage.usage(),
                        pattern(descriptor),
                        synonyms(descriptor));
                printed++;
            }
        }
        return printed;
    }

    /// Renders the sentence shape a usage accepts, e.g. `SAVE what TO destination`.
    static String pattern(VerbDescriptor descriptor) {
        List<String> parts = new ArrayList<>();
        parts.add(descriptor.name());
        if (descriptor.declares(Role.WHAT)) {
            parts.add(descriptor.producesWhat() ? "[what]" : "what");
        }
        for (Role role : Role.values()) {
            if (role == Role.WHAT || !descriptor.declares(role)) {
                continue;
            }
            Keyword keyword = Keyword.forRole(role).orElseThrow();
            String slot = keyword.valueDescription().replaceFirst("^an? ", "");
            if (role == descriptor.implicitRole()) {
                parts.add("[" + keyword.name() + "] " + slot);
            } else if (descriptor.isOptional(role)) {
                parts.add("[" + keyword.name() + " " + slot + "]");
            } else {
                parts.add(keyword.name() + " " + slot);
            }
        }
        return String.join(" ", parts);
    }

    private String synonyms(VerbDescriptor descriptor) {
        if (descriptor.synonyms().isEmpty()) {
            return "";
        }
        return styles.dim("  also: " + String.join(", ", new TreeSet<>(descriptor.synonyms())));
    }
}
