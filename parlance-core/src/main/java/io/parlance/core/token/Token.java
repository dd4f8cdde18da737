package io.parlance.core.token;

import java.util.Objects;

/// A single lexical unit produced by the {@link Tokenizer}.
///
/// The value is kept exactly as it appeared in the input, including a trailing
/// terminator that was attached without whitespace (`"C."`). The {@link #kind()}
/// is derived from the {@link #body()}, so `"[data]."` is a {@link TokenKind#VARIABLE}.
///
/// @param value raw token text, not null
/// @param kind token classification, not null
public record Token(String value, TokenKind kind) {

    public Token {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    /// Creates a token and classifies it from its text.
    ///
    /// @param value raw token text, not null and not empty
    /// @return classified token, never null
    public static Token of(String value) {
        Objects.requireNonNull(value, "value must not be null");
        return new Token(value, classify(value));
    }

    /// Returns whether the character ends a sentence.
    ///
    /// @param c character to test
    /// @return `true` for `.`, `?` and `!`
    public static boolean isTerminator(char c) {
        return c == '.' || c == '?' || c == '!';
    }

    /// Returns whether the last character of the value is a terminator.
    ///
    /// @return `true` for both `"C."` and a standalone `"."`
    public boolean isTerminated() {
        return !value.isEmpty() && isTerminator(value.charAt(value.length() - 1));
    }

    /// Returns the value without one trailing terminator.
    ///
    /// A standalone terminator token has an empty body.
    ///
    /// @return token text minus its attached terminator, never null
    public String body() {
        if (kind == TokenKind.TERMINATOR) {
            return "";
        }
        return isTerminated() ? value.substring(0, value.length() - 1) : value;
    }

    /// Returns whether this token is a tree sentinel rather than real input.
    public boolean isSentinel() {
        return kind == TokenKind.ROOT || kind == TokenKind.TERMINAL;
    }

    private static TokenKind classify(String value) {
        if (!value.isEmpty() && value.chars().allMatch(c -> isTerminator((char) c))) {
            return TokenKind.TERMINATOR;
        }
        String body =
                !value.isEmpty() && isTerminator(value.charAt(value.length() - 1))
                        ? value.substring(0, value.length() - 1)
                        : value;
        if (body.length() >= 2 && body.startsWith("[") && body.endsWith("]")) {
            return TokenKind.VARIABLE;
        }
        if (body.length() >= 2 && body.startsWith("{") && body.endsWith("}")) {
            return TokenKind.REFERENCE;
        }
        return TokenKind.REGULAR;
    }

    @Override
    public String toString() {
        return value;
    }
}
