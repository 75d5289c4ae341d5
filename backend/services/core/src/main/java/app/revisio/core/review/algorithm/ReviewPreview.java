package app.revisio.core.review.algorithm;

import app.revisio.core.review.domain.Rating;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * What each answer button would do to a card, computed at {@code at}.
 */
public record ReviewPreview(
        Instant at,
        double retrievability,
        Map<Rating, SchedulingRecord> outcomes
) {

    public ReviewPreview {
        outcomes = Collections.unmodifiableMap(new EnumMap<>(outcomes));
    }

    public SchedulingRecord outcome(Rating rating) {
        return outcomes.get(rating);
    }

    public Duration delay(Rating rating) {
        return Duration.between(at, outcomes.get(rating).due());
    }

    public Map<Rating, String> labels() {
        Map<Rating, String> out = new EnumMap<>(Rating.class);
        for (Rating rating : outcomes.keySet()) {
            out.put(rating, IntervalLabels.format(delay(rating)));
        }
        return out;
    }
}
