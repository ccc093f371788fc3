package sentencecrypt.benchmark;

import org.junit.jupiter.api.Test;
import sentencecrypt.crypto.Pbkdf2KeyDerivation;
import sentencecrypt.crypto.SeededRandomSource;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BenchmarkRunnerTest {

    @Test
    void run_measuresEveryRungOfTheLadder() {
        BenchmarkRunner runner = new BenchmarkRunner(new Pbkdf2KeyDerivation(), new SeededRandomSource(3), 3);

        List<BenchmarkResult> results = runner.run(List.of(100, 1_000));

        assertThat(results).extracting(BenchmarkResult::iterations).containsExactly(100, 1_000);
        assertThat(results).allSatisfy(r -> {
            assertThat(r.algorithm()).isEqualTo("PBKDF2-HMAC-SHA256");
            assertThat(r.medianNanos()).isPositive();
        });
    }

    @Test
    void median_handlesOddAndEvenSampleCounts() {
        assertThat(BenchmarkRunner.median(new long[]{1, 5, 9})).isEqualTo(5);
        assertThat(BenchmarkRunner.median(new long[]{2, 4, 6, 8})).isEqualTo(5);
    }

    @Test
    void constructor_rejectsNonPositiveRounds() {
        assertThatThrownBy(() -> new BenchmarkRunner(new Pbkdf2KeyDerivation(), new SeededRandomSource(3), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void printTable_writesTableAndCsv() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);

        ResultPrinter.printTable(out, List.of(new BenchmarkResult("PBKDF2-HMAC-SHA256", 200_000, 150_000_000L)), 5);

        String text = bytes.toString(StandardCharsets.UTF_8);
        assertThat(text).contains("KEY DERIVATION COST");
        assertThat(text).contains("(5 rounds, median values)");
        assertThat(text).contains("Algorithm,Iterations,Time (ms)");
        assertThat(text).contains("PBKDF2-HMAC-SHA256,200000,150.000");
        assertThat(text).contains("75.0");
    }
}
