package app.revisio.core.review.algorithm;

import java.time.Duration;
import java.util.Locale;

/**
 * Short labels for answer buttons: {@code 10m}, {@code 3h}, {@code 6d}, {@code 1.5mo}, {@code 2.1y}.
 */
public final class IntervalLabels {

    private static final long MINUTES_PER_HOUR = 60;
    private static final long MINUTES_PER_DAY = 24 * MINUTES_PER_HOUR;

    private IntervalLabels() {
    }

    public static String format(Duration delay) {
        long minutes = Math.max(0, delay.toMinutes());
        if (minutes < MINUTES_PER_HOUR) return minutes + "m";
        if (minutes < MINUTES_PER_DAY) return (minutes / MINUTES_PER_HOUR) + "h";

        long days = minutes / MINUTES_PER_DAY;
        if (days < 30) return days + "d";
        if (days < 365) return oneDecimal(days / 30.0) + "mo";
        return oneDecimal(days / 365.0) + "y";
    }

    private static String oneDecimal(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }
}
