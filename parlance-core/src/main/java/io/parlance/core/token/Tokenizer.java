package io.parlance.core.token;

import java.util.ArrayList;
import java.util.List;

/// Splits raw command text into {@link Token}s.
///
/// Whitespace separates tokens only while both the `{}` and the `[]` depth
/// counters are zero; inside either pair it is kept verbatim. Runs of
/// whitespace never produce empty tokens.
///
/// ### Contracts
/// - **Postcondition**: empty or whitespace-only input yields an empty list
/// - **Invariant**: a closing bracket at depth zero is ordinary content and
///   never drives a counter negative
///
/// An opening bracket that is never closed keeps its counter above zero, so the
/// rest of the input ends up in one token. Quotes carry no special meaning.
///
/// @implNote Stateless and thread-safe.
public final class Tokenizer {

    /// Splits the input into tokens.
    ///
    /// @param input raw command text, may be null
    /// @return ordered tokens, never null (empty for null or blank input)
    public List<Token> tokenize(String input) {
        if (input == null || input.isBlank()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int braceDepth = 0;
        int bracketDepth = 0;

        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            switch (c) {
                case '{' -> braceDepth++;
                case '}' -> braceDepth = Math.max(0, braceDepth - 1);
                case '[' -> bracketDepth++;
                case ']' -> bracketDepth = Math.max(0, bracketDepth - 1);
                default -> {
                    if (isDelimiter(c) && braceDepth == 0 && bracketDepth == 0) {
                        flush(current, tokens);
                        continue;
                    }
                }
            }
            current.append(c);
        }
        flush(current, tokens);

        return tokens;
    }

    private static void flush(StringBuilder current, List<Token> tokens) {
        if (!current.isEmpty()) {
            tokens.add(Token.of(current.toString()));
            current.setLength(0);
        }
    }

    private static boolean isDelimiter(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f';
    }
}
