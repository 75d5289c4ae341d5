package app.revisio.core.review.algorithm;

import app.revisio.core.review.domain.CardState;
import app.revisio.core.review.exception.InvalidSchedulingStateException;

import java.time.Instant;

/**
 * Scheduling state of one flashcard, in real units (days, 1-10 difficulty).
 *
 * @param scheduledDays interval chosen by the last transition into review, 0 for minute-scale steps
 * @param step          index into the learning or relearning step table
 */
public record SchedulingRecord(
        CardState state,
        double stability,
        double difficulty,
        int scheduledDays,
        Instant due,
        Instant lastReview,
        int reps,
        int lapses,
        int step
) {

    public static SchedulingRecord newCard(Instant now) {
        return new SchedulingRecord(CardState.NEW, 0.0, 0.0, 0, now, null, 0, 0, 0);
    }

    public boolean isNew() {
        return state == CardState.NEW;
    }

    /**
     * Rejects records that could only come from corrupted storage. Zero stability is accepted for new and learning
     * cards: it is what a card holds before its first rating.
     */
    public void requireConsistent() {
        if (state == null) {
            throw new InvalidSchedulingStateException("Scheduling record has no state");
        }
        if (!Double.isFinite(stability) || stability < 0.0) {
            throw new InvalidSchedulingStateException("Invalid stability " + stability + " for a " + state.label() + " card");
        }
        if (reps < 0 || lapses < 0 || step < 0 || scheduledDays < 0) {
            throw new InvalidSchedulingStateException("Negative counters on scheduling record: reps=" + reps
                    + ", lapses=" + lapses + ", step=" + step + ", scheduledDays=" + scheduledDays);
        }
        if (due == null) {
            throw new InvalidSchedulingStateException("A " + state.label() + " card has no due date");
        }
        if (isNew()) {
            if (lastReview != null) {
                throw new InvalidSchedulingStateException("A new card cannot have a last review");
            }
            return;
        }
        if (lastReview == null) {
            throw new InvalidSchedulingStateException("A " + state.label() + " card must have a last review");
        }
        // learning recomputes stability from the rating when it is missing, the later phases carry it over
        if ((state == CardState.REVIEW || state == CardState.RELEARNING) && stability < MemoryModel.MIN_STABILITY) {
            throw new InvalidSchedulingStateException("Stability " + stability + " is below the minimum "
                    + MemoryModel.MIN_STABILITY + " for a " + state.label() + " card");
        }
        if (!Double.isFinite(difficulty)
                || difficulty < MemoryModel.MIN_DIFFICULTY
                || difficulty > MemoryModel.MAX_DIFFICULTY) {
            throw new InvalidSchedulingStateException("Difficulty " + difficulty + " is outside [1, 10]");
        }
    }
}
