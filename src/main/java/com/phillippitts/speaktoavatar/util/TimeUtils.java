package com.phillippitts.speaktoavatar.util;

import java.time.Duration;

/**
 * Utility methods for elapsed time and deadline arithmetic based on {@link System#nanoTime()}.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Computes an absolute deadline for a bounded wait.
     *
     * @param timeout how long the caller is willing to wait
     * @return deadline in {@link System#nanoTime()} units
     */
    public static long deadlineAfter(Duration timeout) {
        return System.nanoTime() + timeout.toNanos();
    }

    /**
     * Nanoseconds left before the deadline; zero or negative once it has passed.
     */
    public static long remainingNanos(long deadlineNanos) {
        return deadlineNanos - System.nanoTime();
    }
}
