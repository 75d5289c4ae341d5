package app.revisio.core.review.controller.dto;

import app.revisio.core.review.domain.CardState;
import app.revisio.core.review.domain.Rating;

import java.util.Map;
import java.util.UUID;

public record CardPreviewResponse(
        UUID cardId,
        CardState state,
        double retrievabilityPercent,
        Map<Rating, IntervalPreview> intervals
) {
}
