package sentencecrypt.strength;

/**
 * Human-facing strength bands over an entropy estimate.
 * Each band covers {@code [minBits, next band's minBits)}.
 */
public enum StrengthRating {

    VERY_WEAK("VERY WEAK", 10, 0),
    WEAK("Weak", 25, 30),
    OKAY("Okay", 40, 40),
    MODERATE("Moderate", 60, 60),
    STRONG("Strong", 80, 80),
    VERY_STRONG("VERY STRONG", 95, 100);

    private final String label;
    private final int score;
    private final double minBits;

    StrengthRating(String label, int score, double minBits) {
        this.label = label;
        this.score = score;
        this.minBits = minBits;
    }

    public String label() {
        return label;
    }

    /** Display score on a 0-100 scale. */
    public int score() {
        return score;
    }

    public double minBits() {
        return minBits;
    }

    /**
     * Map an entropy estimate to its band.
     * @throws IllegalArgumentException if {@code bits} is NaN
     */
    public static StrengthRating of(double bits) {
        if (Double.isNaN(bits)) {
            throw new IllegalArgumentException("entropy is NaN");
        }
        StrengthRating[] bands = values();
        for (int i = bands.length - 1; i > 0; i--) {
            if (bits >= bands[i].minBits) {
                return bands[i];
            }
        }
        return VERY_WEAK;
    }
}
