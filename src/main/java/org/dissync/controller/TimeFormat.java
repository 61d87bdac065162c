package org.dissync.controller;

/**
 * Human-friendly relative times.
 */
public final class TimeFormat {

    private static final long MINUTE = 60;
    private static final long HOUR = 60 * MINUTE;
    private static final long DAY = 24 * HOUR;

    private TimeFormat() {
        // Utility class
    }

    /**
     * Formats the distance between {@code epochSeconds} and {@code nowEpochSeconds}, e.g.
     * {@code "3 hours ago"} or {@code "1 minute in the future"}.
     */
    public static String friendly(long epochSeconds, long nowEpochSeconds) {
        long delta = nowEpochSeconds - epochSeconds;
        String suffix = delta >= 0 ? "ago" : "in the future";
        long abs = Math.abs(delta);
        if (abs >= DAY) {
            return plural(abs / DAY, "day") + " " + suffix;
        }
        if (abs >= HOUR) {
            return plural(abs / HOUR, "hour") + " " + suffix;
        }
        if (abs >= MINUTE) {
            return plural(abs / MINUTE, "minute") + " " + suffix;
        }
        return plural(abs, "second") + " " + suffix;
    }

    private static String plural(long amount, String unit) {
        return amount + " " + unit + (amount == 1 ? "" : "s");
    }
}
