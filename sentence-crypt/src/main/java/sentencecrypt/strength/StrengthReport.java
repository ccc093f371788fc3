package sentencecrypt.strength;

import java.util.Locale;

/**
 * An entropy estimate together with its rating.
 */
public record StrengthReport(StrengthRating rating, double bits) {

    public static StrengthReport of(double bits) {
        return new StrengthReport(StrengthRating.of(bits), bits);
    }

    public String label() {
        return rating.label();
    }

    public int score() {
        return rating.score();
    }

    /** e.g. {@code Estimated strength: Weak (~37.6 bits, score 25/100)} */
    public String describe() {
        return String.format(Locale.ROOT, "Estimated strength: %s (~%.1f bits, score %d/100)",
                label(), bits, score());
    }
}
