package io.parlance.core.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TokenTreeTest {

    private final Tokenizer tokenizer = new Tokenizer();

    private TokenTree tree(String input) {
        return TokenTree.of(tokenizer.tokenize(input));
    }

    @Nested
    class Sentinels {

        @Test
        void shouldFrameEmptyTreeWithSentinels() {
            TokenTree empty = TokenTree.of(List.of());

            assertThat(empty.count()).isZero();
            assertThat(empty.isEmpty()).isTrue();
            assertThat(empty.withSentinels())
                    .extracting(Token::kind)
                    .containsExactly(TokenKind.ROOT, TokenKind.TERMINAL);
        }

        @Test
        void shouldExcludeSentinelsFromCount() {
            TokenTree tree = tree("SAY hello world.");

            assertThat(tree.count()).isEqualTo(3);
            assertThat(tree.withSentinels()).hasSize(5);
            assertThat(tree.root().isSentinel()).isTrue();
            assertThat(tree.terminal().isSentinel()).isTrue();
        }

        @Test
        void shouldRejectOutOfRangeIndex() {
            assertThatThrownBy(() -> tree("SAY hi.").get(2))
                    .isInstanceOf(IndexOutOfBoundsException.class);
        }
    }

    @Nested
    class Segments {

        @Test
        void shouldReturnItselfWhenThereIsNoThen() {
            TokenTree tree = tree("SAY hello.");

            assertThat(tree.hasThen()).isFalse();
            assertThat(tree.segments()).containsExactly(tree);
        }

        @Test
        void shouldSplitAtEveryThenIgnoringCase() {
            List<TokenTree> segments =
                    tree("GET [t] FROM {a.txt} then SAY [t] THEN SAY done.").segments();

            assertThat(segments)
                    .extracting(TokenTree::toString)
                    .containsExactly("GET [t] FROM {a.txt}", "SAY [t]", "SAY done.");
        }

        @Test
        void shouldNotSplitAtThenInsideBrackets() {
            assertThat(tree("SAY {a THEN b}.").segments()).hasSize(1);
            assertThat(tree("SAY [then].").hasThen()).isFalse();
        }

        @Test
        void shouldKeepEmptySegments() {
            List<TokenTree> segments = tree("SAY a THEN").segments();

            assertThat(segments).hasSize(2);
            assertThat(segments.get(1).isEmpty()).isTrue();
        }
    }

    @Test
    void shouldReconstructTokensSpaceJoined() {
        assertThat(tree("  GET   [t]  FROM {a   b}. ").toString()).isEqualTo("GET [t] FROM {a   b}.");
    }
}
