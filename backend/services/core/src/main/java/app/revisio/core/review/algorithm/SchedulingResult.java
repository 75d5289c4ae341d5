package app.revisio.core.review.algorithm;

/**
 * @param retrievability recall probability at the moment of the rating, before the rating was applied
 */
public record SchedulingResult(SchedulingRecord record, double retrievability) {
}
