package io.parlance.core.dispatch;

import io.parlance.core.exception.DispatchException;
import io.parlance.core.lexicon.Lexicon;
import io.parlance.core.verb.Role;
import io.parlance.core.verb.Verb;
import io.parlance.core.verb.VerbDescriptor;
import io.parlance.core.verb.VerbRegistry;
import io.parlance.core.word.Keyword;
import io.parlance.core.word.Word;
import io.parlance.core.word.WordChain;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Chooses the implementation of a verb that fits a sentence's structure.
///
/// The sentence is split into an optional qualifier, the direct-object words and
/// the words behind each preposition. Candidates of the verb's family are then
/// tried in dispatch order; the first one whose declared roles line up wins:
/// - every preposition present must introduce a declared role
/// - every declared role must be present unless optional
/// - the candidate's {@link Verb#accepts(Role, Word)} must take each role's first word
/// - a direct object needs a declared `WHAT` or an implicit role whose preposition is absent
/// - {@link Verb#canHandle(WordChain)} must agree
///
/// @implNote Stateless and thread-safe as long as the registry is not refreshed concurrently.
public final class Dispatcher {

    private static final Logger logger = Logger.getLogger(Dispatcher.class.getName());

    private final VerbRegistry registry;
    private final Lexicon lexicon;

    public Dispatcher(VerbRegistry registry, Lexicon lexicon) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.lexicon = Objects.requireNonNull(lexicon, "lexicon must not be null");
    }

    /// Dispatches one sentence segment.
    ///
    /// @param segment words of a single sentence without `THEN`, not null
    /// @return the chosen implementation with its role words, never null
    /// @throws DispatchException if the segment has no verb or no candidate matches
    public DispatchedVerb dispatch(WordChain segment) throws DispatchException {
        Objects.requireNonNull(segment, "segment must not be null");
        Shape shape = Shape.of(segment);

        String family = shape.verb().family();
        List<VerbDescriptor> candidates = registry.candidates(family);
        if (shape.qualifier() != null) {
            String usage = shape.qualifier().usage();
            candidates = candidates.stream().filter(d -> d.usage().equalsIgnoreCase(usage)).toList();
        }
        if (candidates.isEmpty()) {
            throw new DispatchException(
                    shape.qualifier() == null
                            ? "Unknown verb: '" + shape.verb().text() + "'"
                            : "No " + family + " usage named '" + shape.qualifier().text() + "'");
        }

        Map<String, String> rejections = new LinkedHashMap<>();
        for (VerbDescriptor candidate : candidates) {
            Attempt attempt = attempt(candidate, shape, segment);
            if (attempt.matched() != null) {
                logger.fine(() -> "Dispatched '" + segment + "' to " + candidate.id());
                return attempt.matched();
            }
            rejections.putIfAbsent(candidate.usage().toUpperCase(Locale.ROOT), attempt.reason());
        }

        if (rejections.size() == 1) {
            throw new DispatchException(rejections.values().iterator().next());
        }
        throw new DispatchException(
                "No " + family + " usage matches this sentence ("
                        + rejections.entrySet().stream()
                                .map(e -> e.getKey() + ": " + e.getValue())
                                .collect(Collectors.joining("; "))
                        + ")");
    }

    /// Returns the lexicon this dispatcher reads usages from.
    public Lexicon lexicon() {
        return lexicon;
    }

    private Attempt attempt(VerbDescriptor candidate, Shape shape, WordChain segment) {
        String family = candidate.name();
        Verb verb;
        try {
            verb = candidate.newInstance();
        } catch (RuntimeException e) {
            logger.warning("Verb " + candidate.id() + " failed to construct: " + e);
            return Attempt.rejected(candidate.id() + " could not be created");
        }

        Map<Role, List<Word>> bound = new EnumMap<>(Role.class);
        for (Map.Entry<Keyword, List<Word>> entry : shape.prepositions().entrySet()) {
            Role role = entry.getKey().role().orElseThrow();
            if (!candidate.declares(role)) {
                return Attempt.rejected(family + " does not accept " + entry.getKey().name());
            }
            bound.put(role, entry.getValue());
        }

        List<Word> direct = shape.direct();
        if (!direct.isEmpty()) {
            Role implicit = candidate.implicitRole();
            if (candidate.declares(Role.WHAT)) {
                bound.put(Role.WHAT, direct);
            } else if (implicit != null && !bound.containsKey(implicit)) {
                bound.put(implicit, direct);
            } else {
                return Attempt.rejected(family + " does not take a direct object");
            }
        }

        for (Role role : Role.values()) {
            if (!candidate.declares(role)) {
                continue;
            }
            List<Word> words = bound.get(role);
            if (words == null || words.isEmpty()) {
                if (candidate.isOptional(role)) {
                    continue;
                }
                return Attempt.rejected(missing(family, role, candidate, shape));
            }
            Word first = words.get(0);
            if (!accepts(verb, role, first)) {
                return Attempt.rejected(
                        family + " cannot use '" + first.text() + "' after " + position(role, shape));
            }
        }

        if (!canHandle(verb, segment)) {
            return Attempt.rejected(family + " cannot handle this sentence");
        }
        return Attempt.matched(new DispatchedVerb(candidate, verb, bound, shape.qualifier()));
    }

    private static String missing(String family, Role role, VerbDescriptor candidate, Shape shape) {
        if (role == Role.WHAT) {
            if (!shape.prepositions().isEmpty()) {
                return family + " requires a direct object before "
                        + shape.prepositions().keySet().iterator().next().name();
            }
            return family + " requires a direct object";
        }
        Keyword keyword = Keyword.forRole(role).orElseThrow();
        if (role == candidate.implicitRole()) {
            return family + " requires " + keyword.valueDescription();
        }
        return family + " requires " + keyword.name();
    }

    private static String position(Role role, Shape shape) {
        if (role == Role.WHAT) {
            return shape.verb().text().toUpperCase(Locale.ROOT);
        }
        Keyword keyword = Keyword.forRole(role).orElseThrow();
        return shape.prepositions().containsKey(keyword)
                ? keyword.name()
                : shape.verb().text().toUpperCase(Locale.ROOT);
    }

    private static boolean accepts(Verb verb, Role role, Word word) {
        try {
            return verb.accepts(role, word);
        } catch (RuntimeException e) {
            logger.warning(verb.name() + " failed to validate '" + word.text() + "': " + e);
            return false;
        }
    }

    private static boolean canHandle(Verb verb, WordChain segment) {
        try {
            return verb.canHandle(segment);
        } catch (RuntimeException e) {
            logger.warning(verb.name() + " failed to inspect sentence: " + e);
            return false;
        }
    }

    private record Attempt(DispatchedVerb matched, String reason) {
        static Attempt matched(DispatchedVerb verb) {
            return new Attempt(verb, null);
        }

        static Attempt rejected(String reason) {
            return new Attempt(null, reason);
        }
    }

    /// Structural split of a sentence segment.
    ///
    /// @param verb the leading verb
    /// @param qualifier the qualifier right after the verb, or null
    /// @param direct value words between the verb (or qualifier) and the first preposition
    /// @param prepositions words behind each preposition, in sentence order
    private record Shape(
            Word.VerbWord verb,
            Word.QualifierWord qualifier,
            List<Word> direct,
            Map<Keyword, List<Word>> prepositions) {

        static Shape of(WordChain segment) throws DispatchException {
            OptionalInt cursor = segment.first();
            if (cursor.isEmpty()) {
                throw new DispatchException("Empty sentence");
            }
            if (!(segment.get(cursor.getAsInt()) instanceof Word.VerbWord verb)) {
                throw new DispatchException(
                        "Sentence must start with a verb, got: '"
                                + segment.get(cursor.getAsInt()).text() + "'");
            }
            cursor = segment.next(cursor.getAsInt());

            Word.QualifierWord qualifier = null;
            if (cursor.isPresent() && segment.get(cursor.getAsInt()) instanceof Word.QualifierWord q) {
                qualifier = q;
                cursor = segment.next(cursor.getAsInt());
            }

            List<Word> direct = new ArrayList<>();
            Map<Keyword, List<Word>> prepositions = new LinkedHashMap<>();
            List<Word> target = direct;

            while (cursor.isPresent()) {
                Word word = segment.get(cursor.getAsInt());
                if (word instanceof Word.TerminatorWord) {
                    break;
                }
                if (word instanceof Word.KeywordWord keyword) {
                    if (!keyword.keyword().isPreposition()) {
                        throw new DispatchException("Unexpected " + keyword.text() + " inside a sentence");
                    }
                    if (prepositions.containsKey(keyword.keyword())) {
                        throw new DispatchException(
                                keyword.keyword().name() + " appears more than once");
                    }
                    target = new ArrayList<>();
                    prepositions.put(keyword.keyword(), target);
                } else if (word.isValue()) {
                    target.add(word);
                } else {
                    throw new DispatchException("Unexpected word: '" + word.text() + "'");
                }
                cursor = segment.next(cursor.getAsInt());
            }
            return new Shape(verb, qualifier, direct, prepositions);
        }
    }
}
