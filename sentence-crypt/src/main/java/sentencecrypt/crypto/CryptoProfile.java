package sentencecrypt.crypto;

/**
 * Bundles the key derivation and the AEAD cipher used to seal one token.
 * The encrypting and decrypting side must agree on the profile out of band,
 * since the token itself carries no algorithm identifier.
 */
public record CryptoProfile(
        String name,
        KeyDerivation keyDerivation,
        Encryptor encryptor
) {
    public CryptoProfile {
        if (keyDerivation.keyLength() != encryptor.keyLength()) {
            throw new IllegalArgumentException("profile " + name + ": derived key is "
                    + keyDerivation.keyLength() + " bytes but cipher needs " + encryptor.keyLength());
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
