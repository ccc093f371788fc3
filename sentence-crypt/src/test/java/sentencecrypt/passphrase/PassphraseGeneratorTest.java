package sentencecrypt.passphrase;

import org.junit.jupiter.api.Test;
import sentencecrypt.crypto.RandomSource;
import sentencecrypt.crypto.SeededRandomSource;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PassphraseGeneratorTest {

    private final WordList wordList = WordList.of("alpha", "beta", "gamma", "delta");

    @Test
    void generate_joinsRequestedNumberOfWordsWithHyphens() {
        PassphraseGenerator generator = new PassphraseGenerator(new SeededRandomSource(7));

        String passphrase = generator.generate(wordList, 4);

        String[] words = passphrase.split("-");
        assertThat(words).hasSize(4);
        assertThat(words).allSatisfy(word -> assertThat(wordList.contains(word)).isTrue());
    }

    @Test
    void generate_isReproducibleWithTheSameSeed() {
        String first = new PassphraseGenerator(new SeededRandomSource(99)).generate(wordList, 6);
        String second = new PassphraseGenerator(new SeededRandomSource(99)).generate(wordList, 6);

        assertThat(first).isEqualTo(second);
    }

    @Test
    void generate_drawsWithReplacement() {
        PassphraseGenerator generator = new PassphraseGenerator(new SeededRandomSource(1));

        assertThat(generator.generate(WordList.of("solo"), 3)).isEqualTo("solo-solo-solo");
        // more words than the list holds is fine
        assertThat(generator.generate(wordList, 10).split("-")).hasSize(10);
    }

    @Test
    void generate_coversTheWholeListRoughlyEvenly() {
        PassphraseGenerator generator = new PassphraseGenerator(new SeededRandomSource(2024));
        Map<String, Integer> counts = new HashMap<>();

        for (String word : generator.generate(wordList, 4_000).split("-")) {
            counts.merge(word, 1, Integer::sum);
        }

        assertThat(counts).containsOnlyKeys("alpha", "beta", "gamma", "delta");
        assertThat(counts.values()).allSatisfy(n -> assertThat(n).isBetween(850, 1_150));
    }

    @Test
    void generate_withSecureSourceStaysInsideTheList() {
        PassphraseGenerator generator = new PassphraseGenerator(RandomSource.secure());

        assertThat(generator.generate(wordList, 12).split("-"))
                .hasSize(12)
                .allSatisfy(word -> assertThat(wordList.contains(word)).isTrue());
    }

    @Test
    void generate_rejectsNonPositiveCounts() {
        PassphraseGenerator generator = new PassphraseGenerator(new SeededRandomSource(1));

        assertThatThrownBy(() -> generator.generate(wordList, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> generator.generate(wordList, -3))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
