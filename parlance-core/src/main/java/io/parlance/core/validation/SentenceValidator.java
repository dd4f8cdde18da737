package io.parlance.core.validation;

import io.parlance.core.lexicon.Lexicon;
import io.parlance.core.lexicon.VerbUsage;
import io.parlance.core.word.Keyword;
import io.parlance.core.word.Word;
import io.parlance.core.word.WordChain;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.logging.Logger;

/// Grammar check over a {@link WordChain}.
///
/// Sentence-level rules come first (not empty, terminated, starts with a verb).
/// Then each word's next-word contract is checked against its successor and the
/// first violation is reported:
///
/// | Word | May be followed by |
/// |------|--------------------|
/// | verb | qualifier, direct object (if the verb takes one), one of its prepositions |
/// | qualifier | a value |
/// | preposition | a value |
/// | `THEN` | a verb |
/// | value | anything but a verb |
/// | terminator | nothing |
///
/// The check is structural only: whether a file exists or a URL answers is
/// left to execution.
public final class SentenceValidator {

    private static final Logger logger = Logger.getLogger(SentenceValidator.class.getName());

    private final Lexicon lexicon;

    public SentenceValidator(Lexicon lexicon) {
        this.lexicon = Objects.requireNonNull(lexicon, "lexicon must not be null");
    }

    /// Validates a complete sentence.
    ///
    /// @param chain words of the sentence, not null
    /// @return validation outcome, never null
    public ValidationResult validate(WordChain chain) {
        Objects.requireNonNull(chain, "chain must not be null");

        if (chain.isEmpty()) {
            return ValidationResult.failure("Empty sentence");
        }
        if (!(chain.get(chain.last().getAsInt()) instanceof Word.TerminatorWord)) {
            return ValidationResult.failure(
                    "Invalid sentence: must end with a terminator (., ?, or !)");
        }

        Word first = chain.get(chain.first().getAsInt());
        if (first instanceof Word.LiteralWord literal) {
            return ValidationResult.failure("Unknown verb: '" + literal.text() + "'");
        }
        if (!(first instanceof Word.VerbWord)) {
            return ValidationResult.failure(
                    "Sentence must start with a verb, got: '" + first.text() + "'");
        }

        for (int i = 0; i < chain.size(); i++) {
            Word word = chain.get(i);
            OptionalInt nextIndex = chain.next(i);
            Word next = nextIndex.isPresent() ? chain.get(nextIndex.getAsInt()) : null;
            String failure = check(word, next);
            if (failure != null) {
                logger.fine(() -> "Invalid sentence '" + chain + "': " + failure);
                return ValidationResult.failure(failure);
            }
        }
        return ValidationResult.success();
    }

    private String check(Word word, Word next) {
        if (word instanceof Word.VerbWord verb) {
            return afterVerb(verb, next);
        }
        if (word instanceof Word.KeywordWord keyword) {
            return afterKeyword(keyword, next);
        }
        if (word instanceof Word.QualifierWord qualifier) {
            return next != null && next.isValue()
                    ? null
                    : "Qualifier '" + qualifier.text() + "' must be followed by a value";
        }
        if (word instanceof Word.TerminatorWord) {
            return next == null ? null : "Unexpected word after terminator: '" + next.text() + "'";
        }
        if (next instanceof Word.VerbWord verb) {
            return "Unexpected verb '" + verb.text() + "' after '" + word.text()
                    + "'. Use THEN to chain sentences";
        }
        return null;
    }

    private String afterVerb(Word.VerbWord verb, Word next) {
        String family = verb.family();
        if (next instanceof Word.QualifierWord) {
            return null;
        }
        if (next != null && next.isValue() && lexicon.acceptsDirectObject(family)) {
            return null;
        }
        if (next instanceof Word.KeywordWord keyword
                && lexicon.prepositions(family).contains(keyword.keyword())) {
            return null;
        }
        if (next instanceof Word.TerminatorWord && takesNoArguments(family)) {
            return null;
        }
        String shown = next == null ? "end of sentence" : "'" + next.text() + "'";
        return "Invalid word after " + verb.text().toUpperCase(Locale.ROOT) + " verb. Expected "
                + expectation(family) + ", got " + shown;
    }

    private String afterKeyword(Word.KeywordWord keyword, Word next) {
        if (keyword.keyword() == Keyword.THEN) {
            if (next instanceof Word.VerbWord) {
                return null;
            }
            if (next instanceof Word.LiteralWord literal) {
                return "Unknown verb after THEN: '" + literal.text() + "'";
            }
            return "THEN must be followed by a verb";
        }
        if (next != null && next.isValue()) {
            return null;
        }
        String name = keyword.keyword().name();
        return String.format(
                "%s keyword requires %s. Expected [variable], {reference} or literal text after %s.",
                name, keyword.keyword().valueDescription(), name);
    }

    private boolean takesNoArguments(String family) {
        return lexicon.usages(family).stream()
                .map(VerbUsage::descriptor)
                .anyMatch(d -> d.optionalRoles().containsAll(d.roles()));
    }

    private String expectation(String family) {
        List<String> parts = new ArrayList<>();
        List<String> usages = lexicon.usageNames(family);
        if (!usages.isEmpty()) {
            parts.add("a qualifier (" + String.join(", ", usages).toUpperCase(Locale.ROOT) + ")");
        }
        if (lexicon.acceptsDirectObject(family)) {
            parts.add("[variable], {reference} or literal text");
        }
        Set<Keyword> prepositions = lexicon.prepositions(family);
        if (!prepositions.isEmpty()) {
            parts.add(prepositions.stream().map(Keyword::name).toList().toString());
        }
        return String.join(" or ", parts);
    }
}
