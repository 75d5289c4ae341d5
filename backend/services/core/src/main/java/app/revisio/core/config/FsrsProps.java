package app.revisio.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Scheduler settings. Unset values fall back to the built-in parameter table.
 */
@ConfigurationProperties(prefix = "app.review.fsrs")
public record FsrsProps(
        List<Double> weights,
        Double requestRetention,
        List<Integer> learningStepsMinutes,
        List<Integer> relearningStepsMinutes,
        Integer graduatingIntervalDays,
        Integer easyIntervalDays,
        Integer maximumIntervalDays,
        Boolean fuzzEnabled,
        Integer newCardsPerSession
) {

    public boolean fuzzingEnabled() {
        return fuzzEnabled == null || fuzzEnabled;
    }

    public int newCardsLimit() {
        return (newCardsPerSession == null) ? 20 : Math.max(0, newCardsPerSession);
    }
}
