package sentencecrypt.crypto;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;

/**
 * ChaCha20-Poly1305 authenticated encryption.
 * An alternative to AES-GCM that performs well on machines without AES hardware acceleration.
 * Same key, nonce and tag sizes as {@link AesGcmEncryptor}, so tokens keep the same layout.
 */
public class ChaCha20Encryptor implements Encryptor {

    private static final String TRANSFORMATION = "ChaCha20-Poly1305";

    @Override
    public String algorithmName() {
        return "ChaCha20-Poly1305";
    }

    @Override
    public int keyLength() {
        return 32;
    }

    @Override
    public int nonceLength() {
        return 12;
    }

    @Override
    public int tagLength() {
        return 16;
    }

    @Override
    public byte[] encrypt(byte[] key, byte[] nonce, byte[] plaintext) {
        checkSizes(key, nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE,
                    new SecretKeySpec(key, "ChaCha20"),
                    new IvParameterSpec(nonce));
            return cipher.doFinal(plaintext);
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
                    new SecretKeySpec(key, "ChaCha20"),
                    new IvParameterSpec(nonce));
            return cipher.doFinal(ciphertextWithTag);
        } catch (AEADBadTagException e) {
            throw new AuthenticationException("Poly1305 tag mismatch");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(algorithmName() + " decryption failed", e);
        }
    }

    private void checkSizes(byte[] key, byte[] nonce) {
        if (key.length != keyLength()) {
            throw new IllegalArgumentException("key must be " + keyLength() + " bytes, got " + key.length);
        }
        if (nonce.length != nonceLength()) {
            throw new IllegalArgumentException("nonce must be " + nonceLength() + " bytes, got " + nonce.length);
        }
    }
}
