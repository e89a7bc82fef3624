package com.phillippitts.providerrouter.util;

import java.time.Duration;

/**
 * Elapsed time helpers around {@link System#nanoTime()}, used to measure provider call latency.
 *
 * @since 1.0
 */
public final class TimeUtils {

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed time since a nanosecond timestamp.
     *
     * <pre>
     * long startTime = System.nanoTime();
     * // ... call provider ...
     * Duration latency = TimeUtils.elapsedSince(startTime);
     * </pre>
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed duration, never negative
     */
    public static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(Math.max(0L, System.nanoTime() - startNanos));
    }

    /**
     * Converts a duration to fractional milliseconds.
     *
     * @param duration duration to convert
     * @return milliseconds with sub-millisecond precision
     */
    public static double toMillis(Duration duration) {
        return duration.toNanos() / 1_000_000.0;
    }
}
