package sentencecrypt.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import sentencecrypt.crypto.Profiles;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SentenceCryptConfigTest {

    @Test
    void load_readsBundledDefaults() throws Exception {
        SentenceCryptConfig config = SentenceCryptConfig.load();

        assertThat(config.kdfIterations()).isEqualTo(200_000);
        assertThat(config.profile()).isSameAs(Profiles.AES256_GCM);
        assertThat(config.wordListPath()).isEqualTo(Path.of("wordlist.txt"));
        assertThat(config.defaultWords()).isEqualTo(6);
        assertThat(config.minWords()).isEqualTo(4);
        assertThat(config.maxWords()).isEqualTo(20);
    }

    @Test
    void load_appliesFileOverrides(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("override.properties");
        Files.writeString(file, "kdf.iterations=400000\ncipher.profile=chacha20_poly1305\n");

        SentenceCryptConfig config = SentenceCryptConfig.load(file);

        assertThat(config.kdfIterations()).isEqualTo(400_000);
        assertThat(config.profile()).isSameAs(Profiles.CHACHA20_POLY1305);
        assertThat(config.defaultWords()).isEqualTo(6);
    }

    @Test
    void load_systemPropertiesWinOverFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("override.properties");
        Files.writeString(file, "kdf.iterations=400000\n");
        System.setProperty("sentencecrypt.kdf.iterations", "300000");
        try {
            assertThat(SentenceCryptConfig.load(file).kdfIterations()).isEqualTo(300_000);
        } finally {
            System.clearProperty("sentencecrypt.kdf.iterations");
        }
    }

    @Test
    void fromProperties_rejectsInvalidValues() {
        assertThatThrownBy(() -> SentenceCryptConfig.fromProperties(props("kdf.iterations", "0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kdf.iterations");
        assertThatThrownBy(() -> SentenceCryptConfig.fromProperties(props("kdf.iterations", "lots")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not an integer");
        assertThatThrownBy(() -> SentenceCryptConfig.fromProperties(props("cipher.profile", "RC4")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SentenceCryptConfig.fromProperties(props("passphrase.default-words", "30")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("passphrase.default-words");
    }

    @Test
    void clampWordCount_fallsBackBelowMinimumAndCapsAboveMaximum() {
        SentenceCryptConfig config = SentenceCryptConfig.fromProperties(new Properties());

        assertThat(config.clampWordCount(2)).isEqualTo(6);
        assertThat(config.clampWordCount(4)).isEqualTo(4);
        assertThat(config.clampWordCount(12)).isEqualTo(12);
        assertThat(config.clampWordCount(50)).isEqualTo(20);
    }

    private static Properties props(String key, String value) {
        Properties props = new Properties();
        props.setProperty(key, value);
        return props;
    }
}
