package se.ironpass_be.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Whole-day arithmetic on instants, counted in 24h blocks of wall-clock time.
 */
public final class DayMath {

    private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private DayMath() {
    }

    // ceil((to - from) / day)
    public static long ceilDaysBetween(Instant from, Instant to) {
        long diff = to.toEpochMilli() - from.toEpochMilli();
        return -Math.floorDiv(-diff, MILLIS_PER_DAY);
    }

    // floor((to - from) / day)
    public static long floorDaysBetween(Instant from, Instant to) {
        long diff = to.toEpochMilli() - from.toEpochMilli();
        return Math.floorDiv(diff, MILLIS_PER_DAY);
    }

    public static long floorMinutesBetween(Instant from, Instant to) {
        return Math.floorDiv(to.toEpochMilli() - from.toEpochMilli(), Duration.ofMinutes(1).toMillis());
    }
}
