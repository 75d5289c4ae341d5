package app.revisio.core.review.algorithm;

import app.revisio.core.review.domain.CardState;
import app.revisio.core.review.domain.Rating;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Four-phase review state machine (new, learning, review, relearning).
 *
 * <p>Stateless apart from the immutable parameters: safe to share between threads. Callers must serialize
 * reviews of the same card, since each transition consumes the full previous record.
 */
public class FsrsScheduler {

    private final FsrsParameters params;
    private final MemoryModel model;
    private final IntervalFuzz fuzz;

    public FsrsScheduler(FsrsParameters params, IntervalFuzz fuzz) {
        this.params = Objects.requireNonNull(params, "params");
        this.fuzz = Objects.requireNonNull(fuzz, "fuzz");
        this.model = new MemoryModel(params);
    }

    public SchedulingResult review(SchedulingRecord card, Rating rating, Instant now) {
        Objects.requireNonNull(rating, "rating");
        Objects.requireNonNull(now, "now");
        card.requireConsistent();

        double r = retrievability(card, now);
        return new SchedulingResult(transition(card, rating, now, r, fuzz), r);
    }

    /**
     * Outcome of every rating without fuzz. Deterministic for a given {@code now}.
     */
    public ReviewPreview preview(SchedulingRecord card, Instant now) {
        Objects.requireNonNull(now, "now");
        card.requireConsistent();

        double r = retrievability(card, now);
        Map<Rating, SchedulingRecord> outcomes = new EnumMap<>(Rating.class);
        for (Rating rating : Rating.values()) {
            outcomes.put(rating, transition(card, rating, now, r, IntervalFuzz.none()));
        }
        return new ReviewPreview(now, r, outcomes);
    }

    public double retrievability(SchedulingRecord card, Instant now) {
        if (card.lastReview() == null || card.stability() <= 0.0) {
            return 0.0;
        }
        return ForgettingCurve.retrievability(ForgettingCurve.elapsedDays(card.lastReview(), now), card.stability());
    }

    private SchedulingRecord transition(SchedulingRecord card, Rating rating, Instant now, double r, IntervalFuzz fuzz) {
        return switch (card.state()) {
            case NEW -> fromNew(card, rating, now);
            case LEARNING -> fromLearning(card, rating, now);
            case REVIEW -> fromReview(card, rating, now, r, fuzz);
            case RELEARNING -> fromRelearning(card, rating, now);
        };
    }

    private SchedulingRecord fromNew(SchedulingRecord card, Rating rating, Instant now) {
        double d = model.initDifficulty(rating);
        double s = model.initStability(rating);

        return switch (rating) {
            case AGAIN, HARD -> inMinutes(CardState.LEARNING, s, d, 0, card.reps(), card.lapses(),
                    params.learningStepsMinutes().get(0), now);
            case GOOD -> inDays(CardState.REVIEW, s, d, 1, card.lapses(), params.graduatingIntervalDays(), now);
            case EASY -> inDays(CardState.REVIEW, s, d, 1, card.lapses(), params.easyIntervalDays(), now);
        };
    }

    private SchedulingRecord fromLearning(SchedulingRecord card, Rating rating, Instant now) {
        List<Integer> steps = params.learningStepsMinutes();
        double d = card.difficulty();

        if (rating == Rating.AGAIN) {
            return inMinutes(CardState.LEARNING, model.initStability(rating), d, 0, card.reps(), card.lapses(),
                    steps.get(0), now);
        }

        double base = card.stability() > 0.0 ? card.stability() : model.initStability(rating);
        double s = model.nextShortTermStability(base, rating);

        if (rating == Rating.HARD) {
            int step = clampStep(card.step(), steps);
            return inMinutes(CardState.LEARNING, s, d, step, card.reps(), card.lapses(), steps.get(step), now);
        }

        if (rating == Rating.GOOD) {
            int step = card.step() + 1;
            if (step < steps.size()) {
                return inMinutes(CardState.LEARNING, s, d, step, card.reps(), card.lapses(), steps.get(step), now);
            }
            int interval = Math.max(params.graduatingIntervalDays(), plannedInterval(s));
            return inDays(CardState.REVIEW, s, d, 1, card.lapses(), interval, now);
        }

        int interval = Math.max(params.easyIntervalDays(), plannedInterval(s));
        return inDays(CardState.REVIEW, s, d, 1, card.lapses(), interval, now);
    }

    private SchedulingRecord fromReview(SchedulingRecord card, Rating rating, Instant now, double r, IntervalFuzz fuzz) {
        double d = card.difficulty();
        double s = card.stability();
        double nextD = model.nextDifficulty(d, rating);

        if (rating == Rating.AGAIN) {
            double nextS = model.nextForgetStability(d, s, r);
            return inMinutes(CardState.RELEARNING, nextS, nextD, 0, card.reps(), card.lapses() + 1,
                    params.relearningStepsMinutes().get(0), now);
        }

        double nextS = model.nextRecallStability(d, s, r, rating);
        int interval = fuzz.apply(plannedInterval(nextS), params.maximumIntervalDays());

        if (rating == Rating.HARD) {
            interval = Math.max(1, Math.min(interval, card.scheduledDays() + 1));
        } else if (rating == Rating.EASY) {
            int goodInterval = plannedInterval(model.nextRecallStability(d, s, r, Rating.GOOD));
            interval = Math.min(params.maximumIntervalDays(), Math.max(interval, goodInterval + 1));
        }

        return inDays(CardState.REVIEW, nextS, nextD, card.reps() + 1, card.lapses(), interval, now);
    }

    // Stability is left as is on "Again" and "Hard": only the lapse that opened relearning changes it.
    private SchedulingRecord fromRelearning(SchedulingRecord card, Rating rating, Instant now) {
        List<Integer> steps = params.relearningStepsMinutes();
        double d = card.difficulty();
        double s = card.stability();

        switch (rating) {
            case AGAIN:
                return inMinutes(CardState.RELEARNING, s, d, 0, card.reps(), card.lapses(), steps.get(0), now);
            case HARD: {
                int step = clampStep(card.step(), steps);
                return inMinutes(CardState.RELEARNING, s, d, step, card.reps(), card.lapses(), steps.get(step), now);
            }
            case GOOD: {
                int step = card.step() + 1;
                if (step < steps.size()) {
                    return inMinutes(CardState.RELEARNING, s, d, step, card.reps(), card.lapses(), steps.get(step), now);
                }
                return inDays(CardState.REVIEW, s, d, card.reps(), card.lapses(), Math.max(1, plannedInterval(s)), now);
            }
            default: {
                double nextS = model.nextRecallStability(d, s, 0.0, Rating.EASY);
                return inDays(CardState.REVIEW, nextS, d, card.reps(), card.lapses(),
                        Math.max(1, plannedInterval(nextS)), now);
            }
        }
    }

    private int plannedInterval(double stability) {
        return ForgettingCurve.plannedInterval(stability, params.requestRetention(), params.maximumIntervalDays());
    }

    private static int clampStep(int step, List<Integer> steps) {
        return Math.min(step, steps.size() - 1);
    }

    private static SchedulingRecord inMinutes(CardState state, double s, double d, int step,
                                              int reps, int lapses, int minutes, Instant now) {
        return new SchedulingRecord(state, s, d, 0, now.plus(Duration.ofMinutes(minutes)), now, reps, lapses, step);
    }

    private static SchedulingRecord inDays(CardState state, double s, double d,
                                           int reps, int lapses, int days, Instant now) {
        return new SchedulingRecord(state, s, d, days, now.plus(Duration.ofDays(days)), now, reps, lapses, 0);
    }
}
