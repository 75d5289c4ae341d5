package app.revisio.core.review.controller.dto;

import app.revisio.core.review.domain.CardState;
import app.revisio.core.review.domain.Rating;

import java.time.Instant;
import java.util.UUID;

public record ReviewAnswerResponse(
        UUID cardId,
        Rating rating,
        CardState state,
        Instant nextDue,
        int scheduledDays,
        double stability,
        double difficulty,
        double retrievabilityPercent
) {
}
