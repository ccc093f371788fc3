package sentencecrypt.passphrase;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads a word list from line-based text.
 *
 * A line is a word if, after trimming, it is non-empty and does not start with {@code #}.
 * Repeated words are kept once, at their first position.
 */
public final class WordListLoader {

    private static final Logger log = LoggerFactory.getLogger(WordListLoader.class);

    /** Classpath location of the word list shipped with the jar. */
    public static final String BUNDLED_RESOURCE = "/wordlist.txt";

    private WordListLoader() {}

    public static WordList load(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader, path.toString());
        }
    }

    /**
     * Load from {@code path} if it is a regular file, otherwise fall back to the bundled list.
     */
    public static WordList loadOrBundled(Path path) throws IOException {
        if (path != null && Files.isRegularFile(path)) {
            return load(path);
        }
        log.warn("Word list file not found path={}; using bundled list", path);
        return loadBundled();
    }

    public static WordList loadBundled() {
        InputStream in = WordListLoader.class.getResourceAsStream(BUNDLED_RESOURCE);
        if (in == null) {
            throw new IllegalStateException("Bundled word list is missing: " + BUNDLED_RESOURCE);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return load(reader, "classpath:" + BUNDLED_RESOURCE);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * @param source label used in log lines and error messages
     * @throws EmptyWordListException if no line qualifies as a word
     */
    public static WordList load(Reader reader, String source) throws IOException {
        BufferedReader lines = reader instanceof BufferedReader
                ? (BufferedReader) reader
                : new BufferedReader(reader);
        Set<String> words = new LinkedHashSet<>();
        int candidates = 0;

        String line;
        while ((line = lines.readLine()) != null) {
            String word = line.strip();
            if (word.isEmpty() || word.startsWith("#")) {
                continue;
            }
            candidates++;
            words.add(word);
        }

        if (words.isEmpty()) {
            throw new EmptyWordListException(source);
        }
        log.info("Loaded word list source={} words={} duplicatesDropped={}",
                source, words.size(), candidates - words.size());
        return WordList.of(new ArrayList<>(words));
    }
}
