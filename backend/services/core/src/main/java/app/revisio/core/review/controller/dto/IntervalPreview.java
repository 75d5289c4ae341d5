package app.revisio.core.review.controller.dto;

import java.time.Instant;

public record IntervalPreview(
        Instant dueAt,
        String display
) {
}
