package sentencecrypt.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sentencecrypt.crypto.CryptoProfile;
import sentencecrypt.crypto.Profiles;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Runtime settings.
 *
 * Resolution order, later wins:
 * 1. bundled classpath resource {@code sentence-crypt.properties}
 * 2. an optional external properties file
 * 3. system properties prefixed {@code sentencecrypt.}
 */
public record SentenceCryptConfig(
        int kdfIterations,
        String cipherProfile,
        Path wordListPath,
        int defaultWords,
        int minWords,
        int maxWords
) {

    private static final Logger log = LoggerFactory.getLogger(SentenceCryptConfig.class);

    public static final String RESOURCE = "/sentence-crypt.properties";
    public static final String SYSTEM_PREFIX = "sentencecrypt.";

    static final String KDF_ITERATIONS = "kdf.iterations";
    static final String CIPHER_PROFILE = "cipher.profile";
    static final String WORDLIST_PATH = "wordlist.path";
    static final String DEFAULT_WORDS = "passphrase.default-words";
    static final String MIN_WORDS = "passphrase.min-words";
    static final String MAX_WORDS = "passphrase.max-words";

    public SentenceCryptConfig {
        if (kdfIterations <= 0) {
            throw new IllegalArgumentException(KDF_ITERATIONS + " must be positive, got " + kdfIterations);
        }
        if (minWords <= 0) {
            throw new IllegalArgumentException(MIN_WORDS + " must be positive, got " + minWords);
        }
        if (maxWords < minWords) {
            throw new IllegalArgumentException(MAX_WORDS + " must be >= " + MIN_WORDS);
        }
        if (defaultWords < minWords || defaultWords > maxWords) {
            throw new IllegalArgumentException(DEFAULT_WORDS + " must lie in [" + minWords + ", " + maxWords + "]");
        }
        Profiles.byName(cipherProfile);
    }

    public CryptoProfile profile() {
        return Profiles.byName(cipherProfile);
    }

    public static SentenceCryptConfig load() throws IOException {
        return load(null);
    }

    /**
     * @param overrides external properties file, or null for bundled defaults plus system properties
     */
    public static SentenceCryptConfig load(Path overrides) throws IOException {
        Properties props = new Properties();
        try (InputStream in = SentenceCryptConfig.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Bundled configuration is missing: " + RESOURCE);
            }
            props.load(in);
        }

        if (overrides != null) {
            try (Reader r = Files.newBufferedReader(overrides, StandardCharsets.UTF_8)) {
                props.load(r);
            }
            log.info("Loaded configuration overrides path={}", overrides);
        }

        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PREFIX)) {
                props.setProperty(name.substring(SYSTEM_PREFIX.length()), System.getProperty(name));
            }
        }
        return fromProperties(props);
    }

    public static SentenceCryptConfig fromProperties(Properties props) {
        return new SentenceCryptConfig(
                intValue(props, KDF_ITERATIONS, 200_000),
                props.getProperty(CIPHER_PROFILE, "AES256_GCM").trim(),
                Path.of(props.getProperty(WORDLIST_PATH, "wordlist.txt").trim()),
                intValue(props, DEFAULT_WORDS, 6),
                intValue(props, MIN_WORDS, 4),
                intValue(props, MAX_WORDS, 20));
    }

    /**
     * Clamp a requested passphrase length the way the console does:
     * below the minimum falls back to the default, above the maximum is capped.
     */
    public int clampWordCount(int requested) {
        if (requested < minWords) {
            return defaultWords;
        }
        return Math.min(requested, maxWords);
    }

    private static int intValue(Properties props, String key, int fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: " + raw, e);
        }
    }
}
