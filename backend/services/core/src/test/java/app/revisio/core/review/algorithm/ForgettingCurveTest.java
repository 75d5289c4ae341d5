package app.revisio.core.review.algorithm;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ForgettingCurveTest {

    @Test
    void retrievability_isOneWithoutElapsedTime() {
        assertThat(ForgettingCurve.retrievability(0.0, 5.0)).isEqualTo(1.0);
        assertThat(ForgettingCurve.retrievability(-3.0, 0.4)).isEqualTo(1.0);
    }

    @Test
    void retrievability_isZeroForNonPositiveStability() {
        assertThat(ForgettingCurve.retrievability(3.0, 0.0)).isEqualTo(0.0);
        assertThat(ForgettingCurve.retrievability(3.0, -1.0)).isEqualTo(0.0);
    }

    @Test
    void retrievability_reachesNinetyPercentAfterOneStability() {
        assertThat(ForgettingCurve.retrievability(5.0, 5.0)).isCloseTo(0.9, within(1e-9));
        assertThat(ForgettingCurve.retrievability(120.0, 120.0)).isCloseTo(0.9, within(1e-9));
    }

    @Test
    void retrievability_neverIncreasesWithElapsedTime() {
        double stability = 7.5;
        double previous = ForgettingCurve.retrievability(0.0, stability);
        for (double t = 0.25; t < 2000; t *= 1.5) {
            double r = ForgettingCurve.retrievability(t, stability);
            assertThat(r).isLessThanOrEqualTo(previous).isBetween(0.0, 1.0);
            previous = r;
        }
    }

    @Test
    void elapsedDays_handlesMissingAndFutureReviews() {
        Instant now = Instant.parse("2024-03-10T12:00:00Z");

        assertThat(ForgettingCurve.elapsedDays(null, now)).isEqualTo(0.0);
        assertThat(ForgettingCurve.elapsedDays(now.plus(Duration.ofHours(1)), now)).isEqualTo(0.0);
        assertThat(ForgettingCurve.elapsedDays(now.minus(Duration.ofHours(36)), now)).isCloseTo(1.5, within(1e-9));
    }

    @Test
    void plannedInterval_equalsStabilityAtNinetyPercentRetention() {
        assertThat(ForgettingCurve.plannedInterval(10.0, 0.9, 36500)).isEqualTo(10);
        assertThat(ForgettingCurve.plannedInterval(34.19, 0.9, 36500)).isEqualTo(34);
    }

    @Test
    void plannedInterval_isClampedToRange() {
        assertThat(ForgettingCurve.plannedInterval(0.0, 0.9, 36500)).isEqualTo(1);
        assertThat(ForgettingCurve.plannedInterval(0.1, 0.9, 36500)).isEqualTo(1);
        assertThat(ForgettingCurve.plannedInterval(1.0e9, 0.9, 36500)).isEqualTo(36500);
        assertThat(ForgettingCurve.plannedInterval(400.0, 0.9, 365)).isEqualTo(365);
    }

    @Test
    void plannedInterval_isMonotonicInStability() {
        for (double retention : new double[]{0.7, 0.85, 0.9, 0.97}) {
            int previous = 1;
            for (double s = 0.1; s < 100_000; s *= 1.07) {
                int interval = ForgettingCurve.plannedInterval(s, retention, 36500);
                assertThat(interval).isBetween(1, 36500).isGreaterThanOrEqualTo(previous);
                previous = interval;
            }
        }
    }

    @Test
    void plannedInterval_shortensWithHigherRetention() {
        assertThat(ForgettingCurve.plannedInterval(30.0, 0.95, 36500))
                .isLessThan(ForgettingCurve.plannedInterval(30.0, 0.9, 36500));
    }
}
