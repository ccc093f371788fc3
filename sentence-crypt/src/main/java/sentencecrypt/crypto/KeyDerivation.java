package sentencecrypt.crypto;

/**
 * Abstraction for password-based key derivation.
 * Turns a typed password or generated passphrase plus a random salt into a
 * fixed-size symmetric key for the {@link Encryptor}.
 */
public interface KeyDerivation {

    /** Iteration count used when the caller does not supply one. */
    int DEFAULT_ITERATIONS = 200_000;

    String algorithmName();

    /** Length of the derived key in bytes. */
    int keyLength();

    /** Required salt length in bytes. */
    int saltLength();

    /**
     * Derive a key. Identical inputs always yield an identical key.
     *
     * @param password   the secret as typed or generated
     * @param salt       random salt of exactly {@link #saltLength()} bytes
     * @param iterations work factor, must be positive
     * @return a fresh array of {@link #keyLength()} bytes owned by the caller
     * @throws IllegalArgumentException if the salt has the wrong size, iterations is not positive,
     *                                  or the password holds an unpaired surrogate and so has no UTF-8 form
     */
    byte[] derive(String password, byte[] salt, int iterations);

    default byte[] derive(String password, byte[] salt) {
        return derive(password, salt, DEFAULT_ITERATIONS);
    }
}
