package sentencecrypt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sentencecrypt.benchmark.BenchmarkResult;
import sentencecrypt.benchmark.BenchmarkRunner;
import sentencecrypt.benchmark.ResultPrinter;
import sentencecrypt.config.SentenceCryptConfig;
import sentencecrypt.crypto.RandomSource;
import sentencecrypt.passphrase.WordList;
import sentencecrypt.passphrase.WordListLoader;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry point.
 *
 * Usage:
 *   java -jar sentence-crypt.jar [--config file.properties]
 *   java -jar sentence-crypt.jar [--config file.properties] --benchmark [rounds]
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final int BENCHMARK_ROUNDS = 5;

    public static void main(String[] args) {
        try {
            System.exit(run(args));
        } catch (IOException | RuntimeException e) {
            log.error("Startup failed", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    static int run(String[] args) throws IOException {
        Path configPath = null;
        boolean benchmark = false;
        int rounds = BENCHMARK_ROUNDS;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config" -> {
                    if (i + 1 >= args.length) {
                        System.err.println("--config needs a path");
                        return 2;
                    }
                    configPath = Path.of(args[++i]);
                }
                case "--benchmark" -> {
                    benchmark = true;
                    if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                        try {
                            rounds = Integer.parseInt(args[++i]);
                        } catch (NumberFormatException e) {
                            System.err.println("Invalid rounds: " + args[i]);
                            return 2;
                        }
                    }
                }
                default -> {
                    System.err.println("Unknown argument: " + args[i]);
                    return 2;
                }
            }
        }

        SentenceCryptConfig config = SentenceCryptConfig.load(configPath);
        log.info("Configuration profile={} iterations={} wordList={}",
                config.cipherProfile(), config.kdfIterations(), config.wordListPath());

        if (benchmark) {
            BenchmarkRunner runner = new BenchmarkRunner(
                    config.profile().keyDerivation(), RandomSource.secure(), rounds);
            System.out.println("Benchmarking " + config.profile().keyDerivation().algorithmName() + "...");
            List<BenchmarkResult> results = runner.run(BenchmarkRunner.DEFAULT_LADDER);
            ResultPrinter.printTable(System.out, results, rounds);
            return 0;
        }

        WordList wordList = WordListLoader.loadOrBundled(config.wordListPath());
        SentenceCrypt crypt = new SentenceCrypt(config.profile(), config.kdfIterations(), RandomSource.secure());
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        new SentenceCryptConsole(in, System.out, crypt, wordList, config).run();
        return 0;
    }
}
