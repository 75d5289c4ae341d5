package app.revisio.core.review.controller.dto;

import jakarta.validation.constraints.NotNull;

/**
 * @param rating 1 = again, 2 = hard, 3 = good, 4 = easy
 */
public record AnswerCardRequest(
        @NotNull Integer rating
) {}
