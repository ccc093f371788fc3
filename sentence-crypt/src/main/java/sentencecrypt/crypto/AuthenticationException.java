package sentencecrypt.crypto;

/**
 * The AEAD tag did not verify: wrong key, wrong nonce, or altered ciphertext.
 */
public class AuthenticationException extends Exception {

    public AuthenticationException(String message) {
        super(message);
    }
}
