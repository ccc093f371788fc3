package sentencecrypt.crypto;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;
import sentencecrypt.model.Util;

import java.util.Objects;

/**
 * PBKDF2-HMAC-SHA256 via the BouncyCastle lightweight API.
 * The password is strictly encoded as UTF-8 before it enters the PRF.
 */
public class Pbkdf2KeyDerivation implements KeyDerivation {

    private static final int KEY_BYTES = 32;
    private static final int SALT_BYTES = 16;

    @Override
    public String algorithmName() {
        return "PBKDF2-HMAC-SHA256";
    }

    @Override
    public int keyLength() {
        return KEY_BYTES;
    }

    @Override
    public int saltLength() {
        return SALT_BYTES;
    }

    @Override
    public byte[] derive(String password, byte[] salt, int iterations) {
        Objects.requireNonNull(password, "password");
        Objects.requireNonNull(salt, "salt");
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be positive, got " + iterations);
        }
        if (salt.length != SALT_BYTES) {
            throw new IllegalArgumentException("salt must be " + SALT_BYTES + " bytes, got " + salt.length);
        }

        byte[] passwordBytes = Util.utf8(password, "password");
        try {
            PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
            generator.init(passwordBytes, salt, iterations);
            KeyParameter key = (KeyParameter) generator.generateDerivedParameters(KEY_BYTES * 8);
            return key.getKey();
        } finally {
            Util.wipe(passwordBytes);
        }
    }
}
