package sentencecrypt.model;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Shared byte helpers.
 */
public final class Util {

    private Util() {}

    public static byte[] concat(byte[]... arrays) {
        int total = 0;
        for (byte[] a : arrays) total += a.length;
        byte[] result = new byte[total];
        int offset = 0;
        for (byte[] a : arrays) {
            System.arraycopy(a, 0, result, offset, a.length);
            offset += a.length;
        }
        return result;
    }

    /** Overwrite key material once it is no longer needed. Null-safe. */
    public static void wipe(byte[] secret) {
        if (secret != null) {
            Arrays.fill(secret, (byte) 0);
        }
    }

    /**
     * Strict UTF-8 encoding. Unlike {@link String#getBytes}, an unpaired surrogate
     * is rejected rather than replaced with {@code '?'}.
     *
     * @param what names the value in the error message; the value itself is never included
     * @throws IllegalArgumentException if {@code text} is not valid UTF-16
     */
    public static byte[] utf8(String text, String what) {
        ByteBuffer encoded;
        try {
            encoded = StandardCharsets.UTF_8.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(text));
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException(what + " contains an unpaired surrogate and cannot be encoded as UTF-8", e);
        }
        byte[] result = new byte[encoded.remaining()];
        encoded.get(result);
        if (encoded.hasArray()) {
            wipe(encoded.array());
        }
        return result;
    }

    /**
     * Strict UTF-8 decoding. Malformed input is reported, not replaced with U+FFFD.
     */
    public static String fromUtf8(byte[] bytes) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }
}
