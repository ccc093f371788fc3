package sentencecrypt.passphrase;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable, ordered list of distinct words that passphrases are drawn from.
 * Loaded once and then shared read-only.
 */
public final class WordList {

    private final List<String> words;

    private WordList(List<String> words) {
        this.words = words;
    }

    /**
     * @throws EmptyWordListException if {@code words} is empty
     * @throws IllegalArgumentException if a word is blank or appears twice
     */
    public static WordList of(List<String> words) {
        if (words.isEmpty()) {
            throw new EmptyWordListException("no words supplied");
        }
        Set<String> seen = new HashSet<>();
        for (String word : words) {
            if (word == null || word.isBlank()) {
                throw new IllegalArgumentException("word list contains a blank word");
            }
            if (!seen.add(word)) {
                throw new IllegalArgumentException("word list contains a duplicate: " + word);
            }
        }
        return new WordList(List.copyOf(words));
    }

    public static WordList of(String... words) {
        return of(List.of(words));
    }

    public int size() {
        return words.size();
    }

    public String get(int index) {
        return words.get(index);
    }

    public boolean contains(String word) {
        return words.contains(word);
    }

    /** Unmodifiable view of the words in load order. */
    public List<String> words() {
        return words;
    }

    @Override
    public String toString() {
        return "WordList[" + words.size() + " words]";
    }
}
