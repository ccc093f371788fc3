package sentencecrypt.crypto;

/**
 * Source of randomness for salts, nonces and word draws.
 * Production code always uses {@link #secure()}; tests may supply a seeded double.
 */
public interface RandomSource {

    /** Fill the array with random bytes. */
    void nextBytes(byte[] bytes);

    /** Uniform integer in {@code [0, bound)}. */
    int nextInt(int bound);

    default byte[] nextBytes(int length) {
        byte[] bytes = new byte[length];
        nextBytes(bytes);
        return bytes;
    }

    static RandomSource secure() {
        return new SecureRandomSource();
    }
}
