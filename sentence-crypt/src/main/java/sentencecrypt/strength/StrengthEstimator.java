package sentencecrypt.strength;

import sentencecrypt.passphrase.GenerationParams;

/**
 * Heuristic entropy estimates for typed passwords and generated passphrases.
 *
 * The numbers are a signal for the person choosing a secret. They are not a
 * cryptographic guarantee and nothing should accept or reject a secret based on them.
 */
public final class StrengthEstimator {

    static final int LOWERCASE_ALPHABET = 26;
    static final int UPPERCASE_ALPHABET = 26;
    static final int DIGIT_ALPHABET = 10;
    /** Rough count of printable ASCII symbols. */
    static final int SYMBOL_ALPHABET = 32;

    private static final double LN_2 = Math.log(2);

    private StrengthEstimator() {}

    /**
     * Entropy of a passphrase of {@code count} words drawn uniformly and independently
     * from a list of {@code wordListSize} words: {@code count * log2(wordListSize)}.
     * Zero when {@code count <= 0} or {@code wordListSize <= 1}.
     */
    public static double entropyOfGenerated(int count, int wordListSize) {
        if (count <= 0 || wordListSize <= 1) {
            return 0.0;
        }
        return count * log2(wordListSize);
    }

    /**
     * Charset-based estimate for a typed password: {@code length * log2(poolSize)},
     * where the pool adds 26/26/10/32 for each of lowercase, uppercase, digits and
     * symbols present. Length is counted in code points.
     */
    public static double entropyOfTyped(String password) {
        if (password == null || password.isEmpty()) {
            return 0.0;
        }

        boolean lower = false, upper = false, digit = false, symbol = false;
        int length = 0;
        for (int i = 0; i < password.length(); ) {
            int cp = password.codePointAt(i);
            i += Character.charCount(cp);
            length++;

            if (Character.isLowerCase(cp)) {
                lower = true;
            } else if (Character.isUpperCase(cp)) {
                upper = true;
            } else if (Character.isDigit(cp)) {
                digit = true;
            } else if (!Character.isLetterOrDigit(cp)) {
                symbol = true;
            }
            // caseless letters (e.g. CJK) fall in no class
        }

        int poolSize = 0;
        if (lower) poolSize += LOWERCASE_ALPHABET;
        if (upper) poolSize += UPPERCASE_ALPHABET;
        if (digit) poolSize += DIGIT_ALPHABET;
        if (symbol) poolSize += SYMBOL_ALPHABET;

        if (poolSize == 0) {
            return 0.0;
        }
        return length * log2(poolSize);
    }

    public static StrengthRating rate(double bits) {
        return StrengthRating.of(bits);
    }

    public static StrengthReport estimateTyped(String password) {
        return StrengthReport.of(entropyOfTyped(password));
    }

    public static StrengthReport estimateGenerated(GenerationParams params) {
        return StrengthReport.of(entropyOfGenerated(params.wordCount(), params.wordListSize()));
    }

    /**
     * @param generated whether {@code secret} came from the passphrase generator
     * @param params    required when {@code generated} is true, ignored otherwise
     */
    public static StrengthReport estimate(String secret, boolean generated, GenerationParams params) {
        if (!generated) {
            return estimateTyped(secret);
        }
        if (params == null) {
            throw new IllegalArgumentException("generation parameters are required for a generated secret");
        }
        return estimateGenerated(params);
    }

    private static double log2(int n) {
        return Math.log(n) / LN_2;
    }
}
