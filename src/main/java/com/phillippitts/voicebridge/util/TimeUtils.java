package com.phillippitts.voicebridge.util;

import java.time.Duration;

/**
 * Elapsed-time and deadline arithmetic on {@link System#nanoTime()} readings.
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
     * Converts nanoseconds to milliseconds.
     *
     * @param nanos time in nanoseconds
     * @return time in milliseconds (truncated)
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
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
     * Converts a budget into an absolute {@link System#nanoTime()} deadline.
     */
    public static long deadlineNanos(Duration budget) {
        return System.nanoTime() + budget.toNanos();
    }

    /**
     * @return nanoseconds left before {@code deadlineNanos}; zero or negative once it has passed
     */
    public static long remainingNanos(long deadlineNanos) {
        return deadlineNanos - System.nanoTime();
    }

    public static long remainingMillis(long deadlineNanos) {
        return remainingNanos(deadlineNanos) / NANOS_PER_MILLI;
    }
}
