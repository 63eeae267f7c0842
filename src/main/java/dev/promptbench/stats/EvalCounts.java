package dev.promptbench.stats;

import java.util.Optional;

/**
 * Verdict tallies of a pair. The two criteria are counted independently, so {@code okTrue +
 * okFalse} and {@code otherTrue + otherFalse} both equal the number of verdicts.
 */
public record EvalCounts(int okTrue, int okFalse, int otherTrue, int otherFalse) {
    public static final EvalCounts NONE = new EvalCounts(0, 0, 0, 0);

    public int evaluatedCount() {
        return okTrue + okFalse;
    }

    /** share of verdicts with {@code ok}; empty when nothing was evaluated */
    public Optional<Double> okRatio() {
        return ratio(okTrue, okTrue + okFalse);
    }

    /** share of verdicts with {@code other}; empty when nothing was evaluated */
    public Optional<Double> otherRatio() {
        return ratio(otherTrue, otherTrue + otherFalse);
    }

    private static Optional<Double> ratio(int numerator, int denominator) {
        if (denominator == 0) {
            return Optional.empty();
        }
        return Optional.of((double) numerator / denominator);
    }
}
