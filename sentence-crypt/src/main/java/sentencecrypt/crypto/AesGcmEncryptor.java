package sentencecrypt.crypto;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;

/**
 * AES-256-GCM authenticated encryption with a 96-bit nonce and 128-bit tag.
 */
public class AesGcmEncryptor implements Encryptor {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int KEY_BYTES = 32;
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_NONCE_BYTES = 12;

    @Override
    public String algorithmName() {
        return "AES-256-GCM";
    }

    @Override
    public int keyLength() {
        return KEY_BYTES;
    }

    @Override
    public int nonceLength() {
        return GCM_NONCE_BYTES;
    }

    @Override
    public int tagLength() {
        return GCM_TAG_BITS / 8;
    }

    @Override
    public byte[] encrypt(byte[] key, byte[] nonce, byte[] plaintext) {
        checkSizes(key, nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE,
                    new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(GCM_TAG_BITS, nonce));
            return cipher.doFinal(plaintext); // ciphertext + tag appended
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(algorithmName() + " encryption failed", e);
        }
    }

    @Override
    public byte[] decrypt(byte[] key, byte[] nonce, byte[] ciphertextWithTag) throws AuthenticationException {
        checkSizes(key, nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE,
                    new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(GCM_TAG_BITS, nonce));
            return cipher.doFinal(ciphertextWithTag);
        } catch (AEADBadTagException e) {
            throw new AuthenticationException("GCM tag mismatch");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(algorithmName() + " decryption failed", e);
        }
    }

    private void checkSizes(byte[] key, byte[] nonce) {
        if (key.length != KEY_BYTES) {
            throw new IllegalArgumentException("key must be " + KEY_BYTES + " bytes, got " + key.length);
        }
        if (nonce.length != GCM_NONCE_BYTES) {
            throw new IllegalArgumentException("nonce must be " + GCM_NONCE_BYTES + " bytes, got " + nonce.length);
        }
    }
}
