package io.parlance.core.token;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TokenizerTest {

    private Tokenizer tokenizer;

    @BeforeEach
    void setUp() {
        tokenizer = new Tokenizer();
    }

    private List<String> values(String input) {
        return tokenizer.tokenize(input).stream().map(Token::value).toList();
    }

    @Nested
    class Whitespace {

        @Test
        void shouldSplitOnWhitespaceOutsideBrackets() {
            assertThat(values("GET [text] FROM {file.txt}."))
                    .containsExactly("GET", "[text]", "FROM", "{file.txt}.");
        }

        @Test
        void shouldCollapseRunsOfMixedWhitespace() {
            assertThat(values("  SAY\t\n hello \r\f world  "))
                    .containsExactly("SAY", "hello", "world");
        }

        @Test
        void shouldReturnNoTokensForBlankInput() {
            assertThat(tokenizer.tokenize("")).isEmpty();
            assertThat(tokenizer.tokenize(" \t\n ")).isEmpty();
            assertThat(tokenizer.tokenize(null)).isEmpty();
        }

        @Test
        void shouldKeepWhitespaceInsideBracesVerbatim() {
            assertThat(values("SAY {hello   world}.")).containsExactly("SAY", "{hello   world}.");
        }

        @Test
        void shouldKeepWhitespaceInsideSquareBrackets() {
            assertThat(values("SAY [my var].")).containsExactly("SAY", "[my var].");
        }
    }

    @Nested
    class Nesting {

        @Test
        void shouldTreatNestedBracesAsOneToken() {
            assertThat(values("SAY {{{x y}}} .")).containsExactly("SAY", "{{{x y}}}", ".");
        }

        @Test
        void shouldTrackBraceAndBracketDepthIndependently() {
            assertThat(values("LOAD [{a, b}] FROM {c d}."))
                    .containsExactly("LOAD", "[{a, b}]", "FROM", "{c d}.");
        }

        @Test
        void shouldAppendUnmatchedClosingBracketToCurrentToken() {
            assertThat(values("SAY a} b] c.")).containsExactly("SAY", "a}", "b]", "c.");
        }

        @Test
        @DisplayName("an unmatched opening brace absorbs the rest of the input")
        void shouldAbsorbRemainderAfterUnmatchedOpeningBrace() {
            assertThat(values("SAY {a b THEN SAY c.")).containsExactly("SAY", "{a b THEN SAY c.");
        }
    }

    @Nested
    class Terminators {

        @Test
        void shouldAttachTerminatorToPrecedingToken() {
            assertThat(values("SAY hi!")).containsExactly("SAY", "hi!");
        }

        @Test
        void shouldKeepSeparatedTerminatorAsItsOwnToken() {
            List<Token> tokens = tokenizer.tokenize("SAY hi ?");

            assertThat(tokens).extracting(Token::value).containsExactly("SAY", "hi", "?");
            assertThat(tokens.get(2).kind()).isEqualTo(TokenKind.TERMINATOR);
        }

        @Test
        void shouldTreatQuotesAsOrdinaryCharacters() {
            assertThat(values("SAY \"a b\".")).containsExactly("SAY", "\"a", "b\".");
        }
    }

    @Nested
    class Classification {

        @Test
        void shouldClassifyByBodyIgnoringAttachedTerminator() {
            List<Token> tokens = tokenizer.tokenize("SAY [data]. {ref} word");

            assertThat(tokens)
                    .extracting(Token::kind)
                    .containsExactly(
                            TokenKind.REGULAR,
                            TokenKind.VARIABLE,
                            TokenKind.REFERENCE,
                            TokenKind.REGULAR);
        }

        @Test
        void shouldStripOneTrailingTerminatorFromBody() {
            Token token = Token.of("notes.txt.");

            assertThat(token.isTerminated()).isTrue();
            assertThat(token.body()).isEqualTo("notes.txt");
        }

        @Test
        void shouldGiveStandaloneTerminatorAnEmptyBody() {
            Token token = Token.of("!");

            assertThat(token.kind()).isEqualTo(TokenKind.TERMINATOR);
            assertThat(token.body()).isEmpty();
        }
    }
}
