package app.revisio.core.review.algorithm;

import java.time.Duration;
import java.time.Instant;

/**
 * Power-law forgetting curve shared by the scheduler and the interval planner.
 */
public final class ForgettingCurve {

    public static final double DECAY = -0.5;

    /** Chosen so that {@code retrievability(S, S) == 0.9}. */
    public static final double FACTOR = 19.0 / 81.0;

    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private ForgettingCurve() {
    }

    /**
     * Probability that a card with the given stability is still recalled after {@code elapsedDays}.
     */
    public static double retrievability(double elapsedDays, double stability) {
        if (stability <= 0.0) return 0.0;
        if (elapsedDays <= 0.0) return 1.0;
        return Math.pow(1.0 + FACTOR * elapsedDays / stability, DECAY);
    }

    public static double elapsedDays(Instant lastReview, Instant now) {
        if (lastReview == null || now == null) return 0.0;
        return Math.max(0.0, Duration.between(lastReview, now).toMillis() / MILLIS_PER_DAY);
    }

    /**
     * Whole number of days after which retrievability falls to {@code retention}, within {@code [1, maximumInterval]}.
     */
    public static int plannedInterval(double stability, double retention, int maximumInterval) {
        if (stability <= 0.0) return 1;
        double interval = stability / FACTOR * (Math.pow(retention, 1.0 / DECAY) - 1.0);
        long rounded = Math.round(interval);
        return (int) Math.max(1L, Math.min(maximumInterval, rounded));
    }
}
