package com.strategist.core.decompose;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parses and formats calendar durations such as "3 days", "2-3 weeks" or "1.5 months".
 * <p>
 * Weeks are 7 days and months 30. A range counts as its lower bound. Anything
 * that cannot be parsed counts as one day.
 */
public final class DurationParser {

    private static final Pattern NUMBER = Pattern.compile("\\d+(\\.\\d+)?(-\\d+(\\.\\d+)?)?");

    private DurationParser() {}

    public static int toDays(String duration) {
        if (duration == null || duration.isBlank()) {
            return 1;
        }
        String lower = duration.toLowerCase(Locale.ROOT);
        int unit;
        if (lower.contains("day")) {
            unit = 1;
        } else if (lower.contains("week")) {
            unit = 7;
        } else if (lower.contains("month")) {
            unit = 30;
        } else {
            return 1;
        }
        for (String part : lower.trim().split("\\s+")) {
            if (NUMBER.matcher(part).matches()) {
                double value = Double.parseDouble(part.split("-")[0]);
                return (int) (value * unit);
            }
        }
        return 1;
    }

    /** Scales a duration by a complexity multiplier, never going below one day. */
    public static String scale(String duration, double multiplier) {
        int adjusted = Math.max(1, (int) (toDays(duration) * multiplier));
        return format(adjusted);
    }

    /**
     * "0 days", "1 day", "N days" below a week, "X.X weeks" below 30 days, otherwise "X.X months".
     */
    public static String format(int days) {
        if (days <= 0) {
            return "0 days";
        }
        if (days == 1) {
            return "1 day";
        }
        if (days < 7) {
            return days + " days";
        }
        if (days < 30) {
            return String.format(Locale.ROOT, "%.1f weeks", days / 7.0);
        }
        return String.format(Locale.ROOT, "%.1f months", days / 30.0);
    }
}
