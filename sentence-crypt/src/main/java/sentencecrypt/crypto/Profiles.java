package sentencecrypt.crypto;

import java.util.List;
import java.util.Locale;

/**
 * Pre-configured crypto profiles.
 */
public final class Profiles {

    private Profiles() {}

    /** PBKDF2-HMAC-SHA256 + AES-256-GCM. The default. */
    public static final CryptoProfile AES256_GCM = new CryptoProfile(
            "AES256_GCM",
            new Pbkdf2KeyDerivation(),
            new AesGcmEncryptor());

    /** PBKDF2-HMAC-SHA256 + ChaCha20-Poly1305. */
    public static final CryptoProfile CHACHA20_POLY1305 = new CryptoProfile(
            "CHACHA20_POLY1305",
            new Pbkdf2KeyDerivation(),
            new ChaCha20Encryptor());

    /** All profiles in order. */
    public static List<CryptoProfile> all() {
        return List.of(AES256_GCM, CHACHA20_POLY1305);
    }

    /**
     * Look up a profile by name, ignoring case.
     * @throws IllegalArgumentException if no profile has that name
     */
    public static CryptoProfile byName(String name) {
        String wanted = name.trim().toUpperCase(Locale.ROOT);
        for (CryptoProfile profile : all()) {
            if (profile.name().equals(wanted)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unsupported cipher profile: " + name);
    }
}
