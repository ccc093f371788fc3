package sentencecrypt.crypto;

/**
 * Abstraction for authenticated encryption (AEAD).
 * No associated data is bound; the nonce must never repeat under one key.
 */
public interface Encryptor {

    String algorithmName();

    /** Required key length in bytes. */
    int keyLength();

    /** Required nonce length in bytes. */
    int nonceLength();

    /** Length of the authentication tag appended to every ciphertext. */
    int tagLength();

    /**
     * Encrypt plaintext.
     * @return ciphertext with appended authentication tag
     */
    byte[] encrypt(byte[] key, byte[] nonce, byte[] plaintext);

    /**
     * Verify the tag and decrypt. Tag comparison is done by the JCA provider in constant time.
     * @return plaintext
     * @throws AuthenticationException if the tag does not verify
     */
    byte[] decrypt(byte[] key, byte[] nonce, byte[] ciphertextWithTag) throws AuthenticationException;
}
