package io.parlance.core.sentence;

import io.parlance.core.dispatch.DispatchedVerb;
import io.parlance.core.dispatch.Dispatcher;
import io.parlance.core.exception.DispatchException;
import io.parlance.core.token.TokenTree;
import io.parlance.core.word.WordChain;
import io.parlance.core.word.WordFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Builds a {@link Sentence} from a validated token tree.
///
/// Each `THEN` segment gets its own word chain and is dispatched on its own.
/// Every segment is dispatched before anything runs, so a chain with one
/// unmatched step fails without side effects.
public final class SentenceFactory {

    private final WordFactory wordFactory;
    private final Dispatcher dispatcher;

    public SentenceFactory(WordFactory wordFactory, Dispatcher dispatcher) {
        this.wordFactory = Objects.requireNonNull(wordFactory, "wordFactory must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
    }

    /// Dispatches every segment of a sentence.
    ///
    /// @param tree tokens of a sentence that passed validation, not null
    /// @return the sentence with its sub-sentences, never null
    /// @throws DispatchException if any segment has no matching implementation
    public Sentence create(TokenTree tree) throws DispatchException {
        Objects.requireNonNull(tree, "tree must not be null");
        List<TokenTree> segments = tree.segments();

        List<Sentence> dispatched = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            boolean closing = i == segments.size() - 1;
            WordChain words = wordFactory.create(segments.get(i), closing);
            DispatchedVerb verb = dispatcher.dispatch(words);
            dispatched.add(new Sentence(verb, words));
        }

        Sentence root = dispatched.get(0);
        return new Sentence(root.root(), root.words(), dispatched.subList(1, dispatched.size()));
    }
}
