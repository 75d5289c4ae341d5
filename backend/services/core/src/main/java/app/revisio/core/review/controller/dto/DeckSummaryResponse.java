package app.revisio.core.review.controller.dto;

public record DeckSummaryResponse(
        String topic,
        long total,
        long due,
        long newCount,
        long learningCount,
        long reviewCount,
        long relearningCount
) {
}
