package sentencecrypt.crypto;

import java.security.SecureRandom;

/**
 * {@link RandomSource} backed by the platform CSPRNG. Safe to share between threads.
 */
public class SecureRandomSource implements RandomSource {

    private final SecureRandom random = new SecureRandom();

    @Override
    public void nextBytes(byte[] bytes) {
        random.nextBytes(bytes);
    }

    @Override
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }
}
