package sentencecrypt.benchmark;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/**
 * Prints key-derivation benchmark results as a table followed by CSV.
 */
public final class ResultPrinter {

    private ResultPrinter() {}

    public static void printTable(PrintStream out, List<BenchmarkResult> results, int rounds) {
        out.println();
        out.println("=".repeat(64));
        out.println("  KEY DERIVATION COST");
        out.println("  (" + rounds + " rounds, median values)");
        out.println("=".repeat(64));
        out.println();

        out.printf("%-20s | %12s | %10s | %12s%n", "Algorithm", "Iterations", "Time (ms)", "ms / 100k");
        out.println("-".repeat(20) + "-+-" + "-".repeat(12) + "-+-" + "-".repeat(10) + "-+-" + "-".repeat(12));
        for (BenchmarkResult r : results) {
            out.printf(Locale.ROOT, "%-20s | %12d | %10.1f | %12.1f%n",
                    r.algorithm(), r.iterations(), BenchmarkResult.toMillis(r.medianNanos()), r.millisPer100k());
        }
        out.println();

        // CSV output for easy import
        out.println("--- CSV (for spreadsheet import) ---");
        out.println("Algorithm,Iterations,Time (ms)");
        for (BenchmarkResult r : results) {
            out.println(r.algorithm() + "," + r.iterations() + ","
                    + String.format(Locale.ROOT, "%.3f", BenchmarkResult.toMillis(r.medianNanos())));
        }
    }
}
