package io.parlance.core.sentence;

import io.parlance.core.dispatch.DispatchedVerb;
import io.parlance.core.word.WordChain;
import java.util.List;
import java.util.Objects;

/// A validated, dispatched sentence ready to run.
///
/// A `THEN`-chain is one sentence whose first segment is the {@link #root()} and
/// whose remaining segments are {@link #subSentences()}, in the order written.
/// Sub-sentences never have sub-sentences of their own.
///
/// @param root the dispatched verb of this sentence, not null
/// @param words the word chain of this sentence or segment, not null
/// @param subSentences segments that run after the root, not null
public record Sentence(DispatchedVerb root, WordChain words, List<Sentence> subSentences) {

    public Sentence {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(words, "words must not be null");
        subSentences = List.copyOf(subSentences);
    }

    /// Creates a sentence without a chain.
    public Sentence(DispatchedVerb root, WordChain words) {
        this(root, words, List.of());
    }

    public boolean hasSubSentences() {
        return !subSentences.isEmpty();
    }

    /// Number of steps, counting the root.
    public int steps() {
        return 1 + subSentences.size();
    }

    @Override
    public String toString() {
        return words.toString();
    }
}
