package sentencecrypt.token;

/**
 * A token string is not URL-safe base64 or decodes to fewer bytes than a valid token.
 */
public class FormatException extends Exception {

    public FormatException(String message) {
        super(message);
    }
}
