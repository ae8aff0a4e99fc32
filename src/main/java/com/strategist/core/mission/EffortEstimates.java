package com.strategist.core.mission;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Working-time effort arithmetic: an 8-hour day, a 5-day week and a 4-week month.
 */
public final class EffortEstimates {

    static final double HOURS_PER_DAY = 8.0;
    static final double DAYS_PER_WEEK = 5.0;
    static final double WEEKS_PER_MONTH = 4.0;

    private static final Pattern LEADING_NUMBER = Pattern.compile("(\\d+(?:\\.\\d+)?)(?:\\s*-\\s*\\d+(?:\\.\\d+)?)?");

    private EffortEstimates() {}

    /**
     * Converts an effort estimate such as "4 hours", "1.5 days" or "2-3 weeks" to
     * working days. A range counts as its lower bound; anything unparseable is one day.
     */
    public static double toDays(String effort) {
        if (effort == null || effort.isBlank()) {
            return 1.0;
        }
        String lower = effort.toLowerCase(Locale.ROOT);
        Double value = leadingNumber(lower);
        if (value == null) {
            return 1.0;
        }
        if (lower.contains("hour")) {
            return value / HOURS_PER_DAY;
        }
        if (lower.contains("day")) {
            return value;
        }
        if (lower.contains("week")) {
            return value * DAYS_PER_WEEK;
        }
        if (lower.contains("month")) {
            return value * DAYS_PER_WEEK * WEEKS_PER_MONTH;
        }
        return 1.0;
    }

    /**
     * Effort for writing the tests of an implementation task: 40% of an hour-based
     * estimate (at least one hour) or 30% of a day-based one (at least a quarter
     * day, shown in hours below a full day). No estimate gives "0.5 days".
     */
    public static String verificationEffort(String implementationEffort) {
        if (implementationEffort == null || implementationEffort.isBlank()) {
            return "0.5 days";
        }
        String lower = implementationEffort.toLowerCase(Locale.ROOT);
        Double value = leadingNumber(lower);
        if (lower.contains("hour")) {
            if (value == null) {
                return "2 hours";
            }
            return hours(Math.max(1, (int) (value * 0.4)));
        }
        if (value == null) {
            return "0.5 days";
        }
        double days;
        if (lower.contains("day")) {
            days = value;
        } else if (lower.contains("week")) {
            days = value * DAYS_PER_WEEK;
        } else {
            return "0.5 days";
        }
        double testDays = Math.max(0.25, days * 0.3);
        if (testDays < 1) {
            return hours((int) (testDays * HOURS_PER_DAY));
        }
        return String.format(Locale.ROOT, "%.1f days", testDays);
    }

    /**
     * Hours below one day, days below seven, then 5-day weeks below four, then 4-week months.
     */
    public static String formatTotal(double days) {
        if (days <= 0) {
            return "0 days";
        }
        if (days < 1) {
            return hours((int) (days * HOURS_PER_DAY));
        }
        if (days < 7) {
            return String.format(Locale.ROOT, "%.1f days", days);
        }
        double weeks = days / DAYS_PER_WEEK;
        if (weeks < WEEKS_PER_MONTH) {
            return String.format(Locale.ROOT, "%.1f weeks", weeks);
        }
        return String.format(Locale.ROOT, "%.1f months", weeks / WEEKS_PER_MONTH);
    }

    private static String hours(int hours) {
        return hours == 1 ? "1 hour" : hours + " hours";
    }

    private static Double leadingNumber(String text) {
        Matcher m = LEADING_NUMBER.matcher(text);
        return m.find() ? Double.valueOf(m.group(1)) : null;
    }
}
