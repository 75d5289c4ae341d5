package app.revisio.core.review.domain;

import app.revisio.core.review.exception.InvalidRatingException;

public enum Rating {
    AGAIN(1), HARD(2), GOOD(3), EASY(4);

    private final int grade;
    Rating(int grade) { this.grade = grade; }
    public int grade() { return grade; }

    public static Rating fromGrade(int grade) {
        for (Rating r : values()) {
            if (r.grade == grade) return r;
        }
        throw new InvalidRatingException(grade);
    }
}
