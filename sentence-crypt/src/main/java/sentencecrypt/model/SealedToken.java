package sentencecrypt.model;

/**
 * The three parts of a token before encoding: PBKDF2 salt, AEAD nonce,
 * and the ciphertext with its authentication tag appended.
 */
public record SealedToken(
        byte[] salt,
        byte[] nonce,
        byte[] ciphertextWithTag
) {}
