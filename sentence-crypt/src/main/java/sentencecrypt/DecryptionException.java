package sentencecrypt;

/**
 * The only failure {@link SentenceCrypt#decrypt} reports.
 *
 * A malformed token, a wrong password and a corrupted ciphertext all produce this
 * same exception with the same message and no cause, so a caller probing tokens
 * cannot tell them apart.
 */
public class DecryptionException extends Exception {

    static final String MESSAGE = "Decryption failed";

    public DecryptionException() {
        super(MESSAGE);
    }
}
