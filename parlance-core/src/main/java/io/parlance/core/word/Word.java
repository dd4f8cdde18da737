package io.parlance.core.word;

import java.util.Objects;

/// One node of a {@link WordChain}.
///
/// Words are immutable values; their position and links live in the chain.
/// {@link #text()} is always the surface form as typed.
public sealed interface Word
        permits Word.VerbWord,
                Word.KeywordWord,
                Word.QualifierWord,
                Word.LiteralWord,
                Word.VariableWord,
                Word.ReferenceWord,
                Word.TerminatorWord {

    /// Returns the word as it appeared in the input.
    String text();

    /// Returns whether this word can stand as a value: literal, variable or reference.
    default boolean isValue() {
        return this instanceof LiteralWord
                || this instanceof VariableWord
                || this instanceof ReferenceWord;
    }

    /// Sentence-initial action word.
    ///
    /// @param text surface form, e.g. `echo`
    /// @param family canonical verb name the text maps to, e.g. `SAY`
    record VerbWord(String text, String family) implements Word {
        public VerbWord {
            Objects.requireNonNull(text, "text must not be null");
            Objects.requireNonNull(family, "family must not be null");
        }
    }

    /// Preposition or `THEN`.
    record KeywordWord(String text, Keyword keyword) implements Word {
        public KeywordWord {
            Objects.requireNonNull(text, "text must not be null");
            Objects.requireNonNull(keyword, "keyword must not be null");
        }
    }

    /// Type hint naming a usage of the preceding verb, e.g. `TEXT` in `GET TEXT [x] FROM {f}.`
    ///
    /// @param text surface form
    /// @param usage usage name as registered, e.g. `Text`
    record QualifierWord(String text, String usage) implements Word {
        public QualifierWord {
            Objects.requireNonNull(text, "text must not be null");
            Objects.requireNonNull(usage, "usage must not be null");
        }
    }

    /// Bare text.
    record LiteralWord(String text) implements Word {
        public LiteralWord {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /// Bracketed variable slot.
    ///
    /// @param text token text including brackets, e.g. `[data]` or `[{a,b}]`
    /// @param destructuring `true` when the token lists properties to extract
    record VariableWord(String text, boolean destructuring) implements Word {
        public VariableWord {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /// Braced inline value.
    ///
    /// @param text token text including the outer braces
    /// @param payload text with exactly one outer brace layer removed
    record ReferenceWord(String text, String payload) implements Word {
        public ReferenceWord {
            Objects.requireNonNull(text, "text must not be null");
            Objects.requireNonNull(payload, "payload must not be null");
        }
    }

    /// Sentence terminator: `.`, `?` or `!`.
    record TerminatorWord(String text) implements Word {
        public TerminatorWord {
            Objects.requireNonNull(text, "text must not be null");
        }
    }
}
