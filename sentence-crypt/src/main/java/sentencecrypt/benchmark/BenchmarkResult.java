package sentencecrypt.benchmark;

/**
 * Median cost of one key derivation at a given iteration count.
 * Times are in nanoseconds; use {@link #toMillis} for display.
 */
public record BenchmarkResult(String algorithm, int iterations, long medianNanos) {

    public static double toMillis(long nanos) {
        return nanos / 1_000_000.0;
    }

    /** Extrapolated cost per 100 000 iterations, useful for picking a work factor. */
    public double millisPer100k() {
        return toMillis(medianNanos) * 100_000.0 / iterations;
    }
}
