package sentencecrypt.passphrase;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WordListLoaderTest {

    @Test
    void load_skipsBlankLinesAndComments() throws Exception {
        String text = "# header\n"
                + "alpha\n"
                + "\n"
                + "   beta  \n"
                + "  # indented comment\n"
                + "\tgamma\n"
                + "delta#not-a-comment\n";

        WordList list = WordListLoader.load(new StringReader(text), "inline");

        assertThat(list.words()).containsExactly("alpha", "beta", "gamma", "delta#not-a-comment");
    }

    @Test
    void load_keepsFirstOccurrenceOfRepeatedWords() throws Exception {
        WordList list = WordListLoader.load(new StringReader("alpha\nbeta\nalpha\ngamma\nbeta\n"), "inline");

        assertThat(list.words()).containsExactly("alpha", "beta", "gamma");
    }

    @Test
    void load_failsWhenNothingQualifies() {
        assertThatThrownBy(() -> WordListLoader.load(new StringReader("# only\n\n   \n#comments\n"), "inline"))
                .isInstanceOf(EmptyWordListException.class)
                .hasMessageContaining("inline");
    }

    @Test
    void load_readsUtf8File(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("words.txt");
        Files.writeString(file, "café\nnaïve\n", StandardCharsets.UTF_8);

        assertThat(WordListLoader.load(file).words()).containsExactly("café", "naïve");
    }

    @Test
    void loadOrBundled_prefersExistingFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("words.txt");
        Files.writeString(file, "one\ntwo\n");

        assertThat(WordListLoader.loadOrBundled(file).size()).isEqualTo(2);
    }

    @Test
    void loadOrBundled_fallsBackWhenFileIsMissing(@TempDir Path dir) throws Exception {
        WordList list = WordListLoader.loadOrBundled(dir.resolve("missing.txt"));

        assertThat(list.size()).isEqualTo(WordListLoader.loadBundled().size());
    }

    @Test
    void loadBundled_hasAUsefulNumberOfWords() {
        WordList list = WordListLoader.loadBundled();

        assertThat(list.size()).isGreaterThan(256);
        assertThat(list.words()).allSatisfy(word -> assertThat(word).doesNotStartWith("#").isNotBlank());
    }
}
