package io.parlance.core.word;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/// Doubly linked sequence of {@link Word}s stored in a single arena.
///
/// Links are indices into the arena rather than references between words, so
/// words stay immutable values and the chain never forms reference cycles.
///
/// ### Contracts
/// - **Invariant**: `next(a) == b` implies `previous(b) == a`
/// - **Invariant**: the first word has no previous link, the last has no next link
///
/// @implNote **Not thread-safe** while being built. Treat as read-only once
/// handed to the validator or dispatcher.
public final class WordChain implements Iterable<Word> {

    private static final int NONE = -1;

    private final List<Word> words = new ArrayList<>();
    private int[] next = new int[8];
    private int[] previous = new int[8];

    /// Appends a word and links it after the current last word.
    ///
    /// @param word the word to append, not null
    /// @return arena index of the appended word
    public int append(Word word) {
        Objects.requireNonNull(word, "word must not be null");
        int index = words.size();
        if (index == next.length) {
            next = Arrays.copyOf(next, index * 2);
            previous = Arrays.copyOf(previous, index * 2);
        }
        words.add(word);
        next[index] = NONE;
        previous[index] = index == 0 ? NONE : index - 1;
        if (index > 0) {
            next[index - 1] = index;
        }
        return index;
    }

    /// Returns the word at an arena index.
    ///
    /// @param index arena index
    /// @return the word, never null
    /// @throws IndexOutOfBoundsException if the index is not in the chain
    public Word get(int index) {
        return words.get(index);
    }

    public int size() {
        return words.size();
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }

    public OptionalInt first() {
        return words.isEmpty() ? OptionalInt.empty() : OptionalInt.of(0);
    }

    public OptionalInt last() {
        return words.isEmpty() ? OptionalInt.empty() : OptionalInt.of(words.size() - 1);
    }

    /// Returns the index linked after the given one.
    ///
    /// @param index arena index
    /// @return next index, or empty at the end of the chain
    public OptionalInt next(int index) {
        Objects.checkIndex(index, words.size());
        return next[index] == NONE ? OptionalInt.empty() : OptionalInt.of(next[index]);
    }

    /// Returns the index linked before the given one.
    ///
    /// @param index arena index
    /// @return previous index, or empty at the start of the chain
    public OptionalInt previous(int index) {
        Objects.checkIndex(index, words.size());
        return previous[index] == NONE ? OptionalInt.empty() : OptionalInt.of(previous[index]);
    }

    /// Finds the first index at or after `from` whose word satisfies the predicate.
    ///
    /// @param from arena index to start walking from
    /// @param predicate word test, not null
    /// @return matching index, or empty
    public OptionalInt indexOf(int from, Predicate<Word> predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        if (from < 0 || from >= words.size()) {
            return OptionalInt.empty();
        }
        for (int i = from; i != NONE; i = next[i]) {
            if (predicate.test(words.get(i))) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    /// Finds the first word of the given type.
    ///
    /// @param type word variant, not null
    /// @return first matching word, or empty
    public <T extends Word> Optional<T> find(Class<T> type) {
        Objects.requireNonNull(type, "type must not be null");
        return words.stream().filter(type::isInstance).map(type::cast).findFirst();
    }

    /// Returns the words in chain order.
    ///
    /// @return unmodifiable list, never null
    public List<Word> words() {
        return Collections.unmodifiableList(words);
    }

    @Override
    public Iterator<Word> iterator() {
        return words().iterator();
    }

    @Override
    public String toString() {
        return words.stream().map(Word::text).collect(Collectors.joining(" "));
    }
}
