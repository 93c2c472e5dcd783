package io.cinerelay.util;

import java.time.Duration;

/**
 * Human-readable rendering of progress values for status lines.
 */
public final class ProgressFormat {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private ProgressFormat() {
        // Utility class
    }

    public static String bytes(long bytes) {
        if (bytes <= 0) {
            return "0 B";
        }
        int unit = (int) Math.min(UNITS.length - 1, Math.floor(Math.log(bytes) / Math.log(1024)));
        double value = bytes / Math.pow(1024, unit);
        return (Math.round(value * 100) / 100.0) + " " + UNITS[unit];
    }

    public static String speed(double bytesPerSecond) {
        return bytes((long) bytesPerSecond) + "/s";
    }

    public static String eta(Duration eta) {
        long seconds = eta.getSeconds();
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    /**
     * Ten-cell bar, one cell per started 10%.
     */
    public static String bar(int percent) {
        int filled = Math.max(0, Math.min(10, percent / 10));
        return "█".repeat(filled) + "░".repeat(10 - filled);
    }
}
