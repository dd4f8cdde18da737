package io.parlance.core.token;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/// Ordered tokens of one command, bounded by virtual `ROOT` and `TERMINAL` sentinels.
///
/// The sentinels exist even for an empty tree so walkers never special-case the
/// ends. A tree can be split at every `THEN` keyword into sub-segments, each of
/// which is a sentence in its own right.
///
/// ### Contracts
/// - **Invariant**: {@link #count()} excludes the sentinels
/// - **Invariant**: {@link #toString()} reproduces the real tokens space-joined
///
/// @implNote Immutable and thread-safe.
public final class TokenTree implements Iterable<Token> {

    private static final Token ROOT = new Token("", TokenKind.ROOT);
    private static final Token TERMINAL = new Token("", TokenKind.TERMINAL);
    private static final String THEN = "THEN";

    private final List<Token> tokens;

    private TokenTree(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    /// Wraps a token sequence.
    ///
    /// @param tokens ordered tokens, not null (may be empty)
    /// @return new tree, never null
    public static TokenTree of(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        return new TokenTree(tokens);
    }

    public Token root() {
        return ROOT;
    }

    public Token terminal() {
        return TERMINAL;
    }

    /// Returns the number of real tokens.
    public int count() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    /// Returns the real token at the given position.
    ///
    /// @param index zero-based position among real tokens
    /// @return token, never null
    /// @throws IndexOutOfBoundsException if the index is outside `[0, count())`
    public Token get(int index) {
        return tokens.get(index);
    }

    /// Returns the real tokens.
    ///
    /// @return unmodifiable list, never null
    public List<Token> tokens() {
        return tokens;
    }

    /// Returns the tokens framed by the two sentinels.
    ///
    /// @return list of `count() + 2` tokens, never null
    public List<Token> withSentinels() {
        List<Token> framed = new ArrayList<>(tokens.size() + 2);
        framed.add(ROOT);
        framed.addAll(tokens);
        framed.add(TERMINAL);
        return framed;
    }

    /// Returns whether a `THEN` keyword appears anywhere in the tree.
    public boolean hasThen() {
        return tokens.stream().anyMatch(TokenTree::isThen);
    }

    /// Splits the tree at every `THEN` keyword (case-insensitive).
    ///
    /// The keyword itself belongs to no segment. A tree without `THEN` returns a
    /// single segment equal to itself. Empty segments are kept so that callers
    /// can report them.
    ///
    /// @return ordered segments, never null or empty
    public List<TokenTree> segments() {
        if (!hasThen()) {
            return List.of(this);
        }

        List<TokenTree> segments = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        for (Token token : tokens) {
            if (isThen(token)) {
                segments.add(new TokenTree(current));
                current = new ArrayList<>();
            } else {
                current.add(token);
            }
        }
        segments.add(new TokenTree(current));
        return segments;
    }

    private static boolean isThen(Token token) {
        return token.kind() == TokenKind.REGULAR && THEN.equalsIgnoreCase(token.body());
    }

    @Override
    public Iterator<Token> iterator() {
        return tokens.iterator();
    }

    @Override
    public String toString() {
        return tokens.stream().map(Token::value).collect(Collectors.joining(" "));
    }
}
