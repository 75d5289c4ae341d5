package app.revisio.core.review.domain;

import app.revisio.core.review.exception.InvalidSchedulingStateException;

import java.util.Locale;

/**
 * Life-cycle phase of a flashcard. The code is what the flashcards table stores.
 */
public enum CardState {
    NEW(0), LEARNING(1), REVIEW(2), RELEARNING(3);

    private final int code;
    CardState(int code) { this.code = code; }
    public int code() { return code; }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CardState fromCode(int code) {
        for (CardState s : values()) {
            if (s.code == code) return s;
        }
        throw new InvalidSchedulingStateException("Unknown card state code: " + code);
    }
}
