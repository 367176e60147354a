package com.phillippitts.sttserver.util;

/**
 * Helpers for timing with {@link System#nanoTime()}.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /** Number of nanoseconds in one millisecond. */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * @param nanos time in nanoseconds
     * @return time in milliseconds (truncated)
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * <pre>
     * long startTime = System.nanoTime();
     * // ... do work ...
     * long elapsedMs = TimeUtils.elapsedMillis(startTime);
     * </pre>
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return nanosToMillis(System.nanoTime() - startNanos);
    }
}
