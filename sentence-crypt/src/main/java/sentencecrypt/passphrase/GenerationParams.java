package sentencecrypt.passphrase;

/**
 * How a passphrase was generated; enough to compute its entropy without seeing it.
 */
public record GenerationParams(int wordCount, int wordListSize) {

    public static GenerationParams of(int wordCount, WordList wordList) {
        return new GenerationParams(wordCount, wordList.size());
    }
}
