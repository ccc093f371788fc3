package sentencecrypt.benchmark;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sentencecrypt.crypto.KeyDerivation;
import sentencecrypt.crypto.RandomSource;
import sentencecrypt.model.Util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Measures wall-clock time of key derivation across a ladder of iteration counts,
 * so the configured work factor can be chosen for the machine at hand.
 */
public class BenchmarkRunner {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkRunner.class);

    /** Iteration counts measured when the caller gives none. */
    public static final List<Integer> DEFAULT_LADDER = List.of(50_000, 100_000, 200_000, 400_000, 600_000);

    private static final int WARMUP_ROUNDS = 2;
    private static final String SAMPLE_PASSWORD = "correct-horse-battery-staple";

    private final KeyDerivation keyDerivation;
    private final RandomSource random;
    private final int rounds;

    public BenchmarkRunner(KeyDerivation keyDerivation, RandomSource random, int rounds) {
        if (rounds <= 0) {
            throw new IllegalArgumentException("rounds must be positive, got " + rounds);
        }
        this.keyDerivation = keyDerivation;
        this.random = random;
        this.rounds = rounds;
    }

    public List<BenchmarkResult> run(List<Integer> ladder) {
        List<BenchmarkResult> results = new ArrayList<>();
        for (int iterations : ladder) {
            results.add(run(iterations));
        }
        return results;
    }

    /**
     * Benchmark one iteration count.
     *
     * @return median time over {@code rounds} derivations, each with a fresh salt
     */
    public BenchmarkResult run(int iterations) {
        // Warmup: let JIT compile the PRF loop
        for (int i = 0; i < WARMUP_ROUNDS; i++) {
            timeOne(iterations);
        }

        long[] samples = new long[rounds];
        for (int i = 0; i < rounds; i++) {
            samples[i] = timeOne(iterations);
        }
        Arrays.sort(samples);

        BenchmarkResult result = new BenchmarkResult(keyDerivation.algorithmName(), iterations, median(samples));
        log.debug("Benchmarked algorithm={} iterations={} medianNanos={}",
                result.algorithm(), iterations, result.medianNanos());
        return result;
    }

    private long timeOne(int iterations) {
        byte[] salt = random.nextBytes(keyDerivation.saltLength());
        long start = System.nanoTime();
        byte[] key = keyDerivation.derive(SAMPLE_PASSWORD, salt, iterations);
        long elapsed = System.nanoTime() - start;
        Util.wipe(key);
        return elapsed;
    }

    static long median(long[] sorted) {
        int n = sorted.length;
        if (n % 2 == 0) {
            return (sorted[n / 2 - 1] + sorted[n / 2]) / 2;
        }
        return sorted[n / 2];
    }
}
