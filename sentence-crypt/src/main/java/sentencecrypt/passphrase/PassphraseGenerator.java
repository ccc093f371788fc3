package sentencecrypt.passphrase;

import sentencecrypt.crypto.RandomSource;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Builds memorable secrets by drawing words uniformly at random, with replacement,
 * from a {@link WordList}. The same word may appear more than once.
 *
 * Example output: {@code "dragon-forest-galaxy-sunset-matrix-raven"}
 */
public class PassphraseGenerator {

    public static final String SEPARATOR = "-";

    private final RandomSource random;

    public PassphraseGenerator(RandomSource random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * @param count number of words, must be positive
     * @throws IllegalArgumentException if {@code count <= 0}
     */
    public String generate(WordList wordList, int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("word count must be positive, got " + count);
        }
        StringJoiner passphrase = new StringJoiner(SEPARATOR);
        for (int i = 0; i < count; i++) {
            passphrase.add(wordList.get(random.nextInt(wordList.size())));
        }
        return passphrase.toString();
    }
}
