package sentencecrypt.token;

import sentencecrypt.model.SealedToken;
import sentencecrypt.model.Util;

import java.util.Arrays;
import java.util.Base64;

/**
 * Packs salt, nonce and ciphertext into one printable token and back.
 *
 * Token format: URL-safe base64 (padded, no line breaks) of
 * [16-byte salt][12-byte nonce][ciphertext + 16-byte tag]
 *
 * The split points are fixed offsets. There is no version byte or algorithm id,
 * so any change to the salt or nonce size breaks every existing token.
 */
public final class TokenCodec {

    public static final int SALT_BYTES = 16;
    public static final int NONCE_BYTES = 12;
    public static final int MIN_TAG_BYTES = 16;
    public static final int MIN_DECODED_LENGTH = SALT_BYTES + NONCE_BYTES + MIN_TAG_BYTES;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private TokenCodec() {}

    public static String pack(byte[] salt, byte[] nonce, byte[] ciphertextWithTag) {
        if (salt.length != SALT_BYTES) {
            throw new IllegalArgumentException("salt must be " + SALT_BYTES + " bytes, got " + salt.length);
        }
        if (nonce.length != NONCE_BYTES) {
            throw new IllegalArgumentException("nonce must be " + NONCE_BYTES + " bytes, got " + nonce.length);
        }
        if (ciphertextWithTag.length < MIN_TAG_BYTES) {
            throw new IllegalArgumentException("ciphertext is shorter than the authentication tag");
        }
        return ENCODER.encodeToString(Util.concat(salt, nonce, ciphertextWithTag));
    }

    public static String pack(SealedToken token) {
        return pack(token.salt(), token.nonce(), token.ciphertextWithTag());
    }

    /**
     * Decode and split a token.
     * @throws FormatException if the string is not URL-safe base64 or is too short
     */
    public static SealedToken unpack(String token) throws FormatException {
        byte[] packed;
        try {
            packed = DECODER.decode(token);
        } catch (IllegalArgumentException e) {
            throw new FormatException("token is not URL-safe base64");
        }
        if (packed.length < MIN_DECODED_LENGTH) {
            throw new FormatException("token decodes to " + packed.length
                    + " bytes, need at least " + MIN_DECODED_LENGTH);
        }

        byte[] salt = Arrays.copyOfRange(packed, 0, SALT_BYTES);
        byte[] nonce = Arrays.copyOfRange(packed, SALT_BYTES, SALT_BYTES + NONCE_BYTES);
        byte[] ciphertext = Arrays.copyOfRange(packed, SALT_BYTES + NONCE_BYTES, packed.length);
        return new SealedToken(salt, nonce, ciphertext);
    }
}
