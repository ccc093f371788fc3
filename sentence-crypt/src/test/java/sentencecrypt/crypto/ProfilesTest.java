package sentencecrypt.crypto;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProfilesTest {

    @Test
    void byName_isCaseInsensitive() {
        assertThat(Profiles.byName("aes256_gcm")).isSameAs(Profiles.AES256_GCM);
        assertThat(Profiles.byName(" CHACHA20_POLY1305 ")).isSameAs(Profiles.CHACHA20_POLY1305);
    }

    @Test
    void byName_rejectsUnknownProfile() {
        assertThatThrownBy(() -> Profiles.byName("DES"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("DES");
    }

    @Test
    void profile_rejectsMismatchedKeySizes() {
        KeyDerivation shortKeys = new Pbkdf2KeyDerivation() {
            @Override
            public int keyLength() {
                return 16;
            }
        };

        assertThatThrownBy(() -> new CryptoProfile("BROKEN", shortKeys, new AesGcmEncryptor()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
