package sentencecrypt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sentencecrypt.crypto.AuthenticationException;
import sentencecrypt.crypto.CryptoProfile;
import sentencecrypt.crypto.KeyDerivation;
import sentencecrypt.crypto.Profiles;
import sentencecrypt.crypto.RandomSource;
import sentencecrypt.model.SealedToken;
import sentencecrypt.model.Util;
import sentencecrypt.passphrase.GenerationParams;
import sentencecrypt.passphrase.PassphraseGenerator;
import sentencecrypt.passphrase.WordList;
import sentencecrypt.strength.StrengthEstimator;
import sentencecrypt.strength.StrengthReport;
import sentencecrypt.token.FormatException;
import sentencecrypt.token.TokenCodec;

import java.nio.charset.CharacterCodingException;
import java.util.Objects;

/**
 * Password-based encryption of short text into a single portable token.
 *
 * Encrypt:
 * 1. Draw a fresh 16-byte salt and derive a 256-bit key from the password
 * 2. Draw a fresh 12-byte nonce and seal the UTF-8 plaintext with the AEAD cipher
 * 3. Encode salt || nonce || ciphertext+tag as URL-safe base64
 *
 * Decrypt reverses the steps. Every call derives its own key and never caches it:
 * the fresh salt is what keeps a random nonce from repeating under one key.
 *
 * Instances hold no mutable state and may be shared between threads.
 */
public class SentenceCrypt {

    private static final Logger log = LoggerFactory.getLogger(SentenceCrypt.class);

    private final CryptoProfile profile;
    private final int iterations;
    private final RandomSource random;
    private final PassphraseGenerator passphraseGenerator;

    public SentenceCrypt(CryptoProfile profile, int iterations, RandomSource random) {
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be positive, got " + iterations);
        }
        this.profile = Objects.requireNonNull(profile, "profile");
        this.iterations = iterations;
        this.random = Objects.requireNonNull(random, "random");
        this.passphraseGenerator = new PassphraseGenerator(random);
        if (profile.keyDerivation().saltLength() != TokenCodec.SALT_BYTES
                || profile.encryptor().nonceLength() != TokenCodec.NONCE_BYTES) {
            throw new IllegalArgumentException("profile " + profile.name() + " does not fit the token layout");
        }
    }

    /** AES-256-GCM, 200 000 PBKDF2 iterations, platform CSPRNG. */
    public static SentenceCrypt withDefaults() {
        return new SentenceCrypt(Profiles.AES256_GCM, KeyDerivation.DEFAULT_ITERATIONS, RandomSource.secure());
    }

    public CryptoProfile profile() {
        return profile;
    }

    public int iterations() {
        return iterations;
    }

    /**
     * @throws IllegalArgumentException if the plaintext or password is not valid Unicode text
     *                                  (an unpaired surrogate cannot be encoded as UTF-8)
     */
    public String encrypt(String plaintext, String password) {
        Objects.requireNonNull(plaintext, "plaintext");
        Objects.requireNonNull(password, "password");
        byte[] message = Util.utf8(plaintext, "plaintext");
        requireEncodable(password);

        byte[] salt = random.nextBytes(profile.keyDerivation().saltLength());
        byte[] nonce = random.nextBytes(profile.encryptor().nonceLength());
        byte[] key = profile.keyDerivation().derive(password, salt, iterations);
        try {
            byte[] ciphertext = profile.encryptor().encrypt(key, nonce, message);
            String token = TokenCodec.pack(new SealedToken(salt, nonce, ciphertext));
            log.debug("Encrypted profile={} iterations={} plaintextBytes={} tokenChars={}",
                    profile.name(), iterations, message.length, token.length());
            return token;
        } finally {
            Util.wipe(key);
            Util.wipe(message);
        }
    }

    /**
     * @throws DecryptionException if the token is malformed, was altered, or the password is wrong
     * @throws IllegalArgumentException if the password is not valid Unicode text; checked before the token
     */
    public String decrypt(String token, String password) throws DecryptionException {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(password, "password");
        requireEncodable(password);

        SealedToken sealed;
        try {
            sealed = TokenCodec.unpack(token);
        } catch (FormatException e) {
            // same key-derivation cost as a wrong password
            Util.wipe(profile.keyDerivation().derive(
                    password, new byte[profile.keyDerivation().saltLength()], iterations));
            throw failure();
        }

        byte[] key = profile.keyDerivation().derive(password, sealed.salt(), iterations);
        byte[] message = null;
        try {
            message = profile.encryptor().decrypt(key, sealed.nonce(), sealed.ciphertextWithTag());
            String plaintext = Util.fromUtf8(message);
            log.debug("Decrypted profile={} iterations={} plaintextBytes={}",
                    profile.name(), iterations, message.length);
            return plaintext;
        } catch (AuthenticationException | CharacterCodingException e) {
            throw failure();
        } finally {
            Util.wipe(key);
            Util.wipe(message);
        }
    }

    public String generatePassphrase(WordList wordList, int count) {
        return passphraseGenerator.generate(wordList, count);
    }

    /**
     * @param params how the secret was generated; required when {@code generated} is true
     */
    public StrengthReport estimateStrength(String secret, boolean generated, GenerationParams params) {
        return StrengthEstimator.estimate(secret, generated, params);
    }

    private static void requireEncodable(String password) {
        Util.wipe(Util.utf8(password, "password"));
    }

    private DecryptionException failure() {
        log.debug("Decryption rejected profile={}", profile.name());
        return new DecryptionException();
    }
}
