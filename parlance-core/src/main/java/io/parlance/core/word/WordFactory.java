package io.parlance.core.word;

import io.parlance.core.lexicon.Lexicon;
import io.parlance.core.lexicon.VerbUsage;
import io.parlance.core.match.TokenMatcher;
import io.parlance.core.token.Token;
import io.parlance.core.token.TokenKind;
import io.parlance.core.token.TokenTree;
import io.parlance.core.verb.VerbRegistry;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Turns a {@link TokenTree} into a {@link WordChain}.
///
/// Variable, reference and terminator tokens map directly. A regular token is
/// tried, in order, as:
/// 1. a verb name or synonym, only at the start of a sentence or after `THEN`
/// 2. a keyword (`FROM`, `TO`, `USING`, `WITH`, `THEN`)
/// 3. a qualifier: a usage name of the preceding verb, followed by another value
/// 4. a literal
///
/// Only the trailing terminator of the final token ends the sentence; the same
/// character inside any earlier token is literal content.
public final class WordFactory {

    private static final Logger logger = Logger.getLogger(WordFactory.class.getName());

    private final VerbRegistry registry;
    private final Lexicon lexicon;
    private final TokenMatcher matcher;

    public WordFactory(VerbRegistry registry, Lexicon lexicon, TokenMatcher matcher) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.lexicon = Objects.requireNonNull(lexicon, "lexicon must not be null");
        this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
    }

    /// Builds the word chain of a complete sentence.
    ///
    /// @param tree tokens of the sentence, not null
    /// @return the chain, empty for an empty tree
    public WordChain create(TokenTree tree) {
        return create(tree, true);
    }

    /// Builds the word chain of a sentence or of one `THEN` segment.
    ///
    /// @param tree tokens to convert, not null
    /// @param closing whether the last token's trailing terminator ends the sentence
    /// @return the chain, never null
    public WordChain create(TokenTree tree, boolean closing) {
        Objects.requireNonNull(tree, "tree must not be null");
        WordChain chain = new WordChain();
        List<Token> tokens = tree.tokens();
        boolean expectVerb = true;

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            boolean last = i == tokens.size() - 1;
            boolean splitTerminator =
                    closing && last && token.isTerminated() && token.kind() != TokenKind.TERMINATOR;

            Token next = last ? null : tokens.get(i + 1);
            Word word;
            if (token.kind() == TokenKind.TERMINATOR) {
                word = new Word.TerminatorWord(token.value());
            } else if (splitTerminator) {
                word = classify(token.body(), token.kind(), chain, expectVerb, null);
            } else if (token.isTerminated()) {
                word = new Word.LiteralWord(token.value());
            } else {
                word = classify(token.value(), token.kind(), chain, expectVerb, next);
            }

            chain.append(word);
            expectVerb =
                    word instanceof Word.KeywordWord keyword && keyword.keyword() == Keyword.THEN;

            if (splitTerminator) {
                String value = token.value();
                chain.append(new Word.TerminatorWord(value.substring(value.length() - 1)));
            }
        }

        logger.fine(() -> "Words: " + chain);
        return chain;
    }

    private Word classify(
            String text,
            TokenKind kind,
            WordChain chain,
            boolean expectVerb,
            Token next) {
        switch (kind) {
            case VARIABLE -> {
                return new Word.VariableWord(text, matcher.isDestructuring(text));
            }
            case REFERENCE -> {
                return new Word.ReferenceWord(text, matcher.referencePayload(text));
            }
            default -> {
                return regular(text, chain, expectVerb, next);
            }
        }
    }

    /// @param next following token, or null when nothing but the terminator follows
    private Word regular(String text, WordChain chain, boolean expectVerb, Token next) {
        if (expectVerb) {
            Optional<String> family = registry.family(text);
            if (family.isPresent()) {
                return new Word.VerbWord(text, family.get());
            }
        }

        Optional<Keyword> keyword = Keyword.parse(text);
        if (keyword.isPresent()) {
            return new Word.KeywordWord(text, keyword.get());
        }

        if (next != null && startsValue(next) && chain.last().isPresent()
                && chain.get(chain.last().getAsInt()) instanceof Word.VerbWord verb) {
            Optional<VerbUsage> usage = lexicon.findUsage(verb.family(), text);
            if (usage.isPresent()) {
                return new Word.QualifierWord(text, usage.get().usage());
            }
        }

        return new Word.LiteralWord(text);
    }

    private static boolean startsValue(Token next) {
        if (next.kind() == TokenKind.TERMINATOR) {
            return false;
        }
        return Keyword.parse(next.body()).isEmpty();
    }
}
