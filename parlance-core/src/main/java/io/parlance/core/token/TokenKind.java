package io.parlance.core.token;

/// Classification of a {@link Token} by its surface shape.
///
/// `ROOT` and `TERMINAL` never come out of the {@link Tokenizer}; they only mark
/// the virtual bounds of a {@link TokenTree}.
public enum TokenKind {
    /// Plain word: verb, keyword, qualifier or literal text.
    REGULAR,
    /// Bracketed slot such as `[name]` or `[{a,b}]`.
    VARIABLE,
    /// Braced inline value such as `{file.txt}`.
    REFERENCE,
    /// Standalone sentence terminator (`.`, `?` or `!`).
    TERMINATOR,
    /// Leading sentinel of a token tree.
    ROOT,
    /// Trailing sentinel of a token tree.
    TERMINAL
}
