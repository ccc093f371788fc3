package sentencecrypt.passphrase;

/**
 * A word-list source yielded no usable words.
 */
public class EmptyWordListException extends IllegalArgumentException {

    public EmptyWordListException(String source) {
        super("Word list is empty: " + source);
    }
}
