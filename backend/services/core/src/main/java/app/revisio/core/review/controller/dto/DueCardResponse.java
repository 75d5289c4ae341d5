package app.revisio.core.review.controller.dto;

import app.revisio.core.review.domain.CardState;
import app.revisio.core.review.domain.Rating;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record DueCardResponse(
        UUID cardId,
        String front,
        String back,
        CardState state,
        double stability,
        double difficulty,
        int reps,
        int lapses,
        Instant dueAt,
        double retrievabilityPercent,
        Map<Rating, IntervalPreview> intervals
) {
}
