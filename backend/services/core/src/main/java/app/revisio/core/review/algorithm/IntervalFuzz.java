package app.revisio.core.review.algorithm;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import java.util.random.RandomGenerator;

/**
 * Random spread applied to review intervals so that cards learned together do not all fall due on the same day.
 */
public final class IntervalFuzz {

    static final double MIN_FUZZ_DAYS = 2.5;
    static final double FUZZ_RATIO = 0.05;

    private static final IntervalFuzz NONE = new IntervalFuzz(null);

    private final Supplier<? extends RandomGenerator> source;

    private IntervalFuzz(Supplier<? extends RandomGenerator> source) {
        this.source = source;
    }

    public static IntervalFuzz none() {
        return NONE;
    }

    /** Thread-safe fuzz for production use. */
    public static IntervalFuzz random() {
        return new IntervalFuzz(ThreadLocalRandom::current);
    }

    /** The generator is shared by every call, so it must only be used from one thread unless it is thread-safe. */
    public static IntervalFuzz using(RandomGenerator random) {
        Objects.requireNonNull(random, "random");
        return new IntervalFuzz(() -> random);
    }

    public boolean isEnabled() {
        return source != null;
    }

    /**
     * Largest offset, in days, that may be added to or removed from {@code interval}. Zero when the interval is too
     * short to be fuzzed.
     */
    public static int range(int interval) {
        if (interval < MIN_FUZZ_DAYS) return 0;
        return (int) Math.max(1L, Math.round(interval * FUZZ_RATIO));
    }

    public int apply(int interval, int maximumInterval) {
        int range = range(interval);
        if (source == null || range == 0) {
            return interval;
        }
        int fuzzed = interval + source.get().nextInt(-range, range + 1);
        return Math.max(1, Math.min(maximumInterval, fuzzed));
    }
}
