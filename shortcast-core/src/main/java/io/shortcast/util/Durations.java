package io.shortcast.util;

import java.time.Duration;

/**
 * Duration formatting for log lines.
 */
public final class Durations {

    private Durations() {
    }

    /**
     * Formats a duration as {@code Xh Ym Zs}, dropping leading zero units
     * ({@code 42s}, {@code 3m 5s}, {@code 1h 0m 12s}). Negative durations format as {@code 0s}.
     *
     * @param duration the duration
     * @return the formatted text
     */
    public static String format(Duration duration) {
        long total = duration.isNegative() ? 0 : duration.getSeconds();
        long hours = total / 3600;
        long minutes = (total % 3600) / 60;
        long seconds = total % 60;
        if (hours > 0) {
            return hours + "h " + minutes + "m " + seconds + "s";
        }
        if (minutes > 0) {
            return minutes + "m " + seconds + "s";
        }
        return seconds + "s";
    }

    /**
     * Formats a remaining cooldown as {@code Xh Ym}.
     *
     * @param duration the duration
     * @return the formatted text
     */
    public static String formatHoursMinutes(Duration duration) {
        long total = duration.isNegative() ? 0 : duration.toMinutes();
        return (total / 60) + "h " + (total % 60) + "m";
    }
}
