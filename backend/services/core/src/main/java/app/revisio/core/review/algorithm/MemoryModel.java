package app.revisio.core.review.algorithm;

import app.revisio.core.review.domain.Rating;

import java.util.Objects;

/**
 * Difficulty and stability formulas. Every result respects {@code stability >= 0.1} and
 * {@code 1 <= difficulty <= 10} whatever the weight table holds.
 */
public final class MemoryModel {

    public static final double MIN_STABILITY = 0.1;
    public static final double MIN_DIFFICULTY = 1.0;
    public static final double MAX_DIFFICULTY = 10.0;

    private final FsrsParameters params;

    public MemoryModel(FsrsParameters params) {
        this.params = Objects.requireNonNull(params, "params");
    }

    public double initDifficulty(Rating rating) {
        double d = params.w(4) - Math.exp(params.w(5) * (rating.grade() - 1.0)) + 1.0;
        return clampDifficulty(d);
    }

    public double initStability(Rating rating) {
        return Math.max(MIN_STABILITY, params.w(rating.grade() - 1));
    }

    /**
     * Mean reversion toward the difficulty of a first "Good" answer.
     */
    public double nextDifficulty(double d, Rating rating) {
        double delta = -(params.w(7) * (rating.grade() - 3.0));
        double reverted = params.w(6) * initDifficulty(Rating.GOOD) + (1.0 - params.w(6)) * (d + delta);
        return clampDifficulty(reverted);
    }

    public double nextRecallStability(double d, double s, double r, Rating rating) {
        double hardPenalty = (rating == Rating.HARD) ? params.w(15) : 1.0;
        double easyBonus = (rating == Rating.EASY) ? params.w(16) : 1.0;

        double growth = Math.exp(params.w(8))
                * (11.0 - d)
                * Math.pow(s, -params.w(9))
                * (Math.exp(params.w(10) * (1.0 - r)) - 1.0)
                * hardPenalty
                * easyBonus;

        double next = s * (growth + 1.0);
        // negative weights must not let a successful answer shrink stability
        return floorStability(Math.max(s, next));
    }

    /**
     * Stability after a lapse. Never higher than the stability held before the lapse.
     */
    public double nextForgetStability(double d, double s, double r) {
        double next = params.w(11)
                * Math.pow(d, -params.w(12))
                * (Math.pow(s + 1.0, params.w(13)) - 1.0)
                * Math.exp(params.w(14) * (1.0 - r));
        if (!Double.isFinite(next)) {
            next = s;
        }
        return Math.max(MIN_STABILITY, Math.min(s, next));
    }

    public double nextShortTermStability(double s, Rating rating) {
        return floorStability(s * Math.exp(params.w(14) * (rating.grade() - 3.0 + params.w(15))));
    }

    private static double floorStability(double s) {
        if (Double.isNaN(s)) return MIN_STABILITY;
        return Math.max(MIN_STABILITY, s);
    }

    private static double clampDifficulty(double d) {
        if (Double.isNaN(d)) return MIN_DIFFICULTY;
        return Math.max(MIN_DIFFICULTY, Math.min(MAX_DIFFICULTY, d));
    }
}
