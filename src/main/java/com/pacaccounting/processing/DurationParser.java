package com.pacaccounting.processing;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the many ways a duration is typed into timesheets and returns whole minutes.
 * <ul>
 *     <li>explicit markers: "2h30", "2h30m", "2 h 30 min", "1,5h", "45m";</li>
 *     <li>clock notation: "2:30";</li>
 *     <li>a decimal number up to 24 is hours ("1.5" and "1,5" are 90 minutes);</li>
 *     <li>any other number is minutes.</li>
 * </ul>
 * Text that cannot be read is zero. The result is never negative.
 */
public final class DurationParser {

    private static final Pattern HOURS = Pattern.compile("(\\d+(?:[.,]\\d+)?)\\s*h");
    private static final Pattern MINUTES = Pattern.compile("(\\d+)\\s*m");
    private static final Pattern MINUTES_AFTER_HOURS = Pattern.compile("h[a-z]*\\s*(\\d+)\\s*$");
    private static final Pattern CLOCK = Pattern.compile("^(\\d+):([0-5]?\\d)(?::\\d{1,2})?$");
    private static final double MAX_DECIMAL_HOURS = 24.0;

    private DurationParser() {
    }

    public static int toMinutes(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number number) {
            return fromNumber(number.doubleValue(), !(value instanceof Integer || value instanceof Long));
        }
        return toMinutes(value.toString());
    }

    public static int toMinutes(String value) {
        if (value == null) {
            return 0;
        }
        String text = value.trim().toLowerCase(Locale.ROOT);
        if (text.isEmpty()) {
            return 0;
        }

        Matcher hours = HOURS.matcher(text);
        Matcher minutes = MINUTES.matcher(text);
        boolean hasHours = hours.find();
        boolean hasMinutes = minutes.find();
        if (hasHours || hasMinutes) {
            double hourValue = hasHours ? parseDecimal(hours.group(1)) : 0.0;
            int minuteValue = 0;
            if (hasMinutes) {
                minuteValue = parseInt(minutes.group(1));
            } else {
                // "2h30": trailing digits after the hour marker are minutes
                Matcher trailing = MINUTES_AFTER_HOURS.matcher(text);
                if (trailing.find()) {
                    minuteValue = parseInt(trailing.group(1));
                }
            }
            long total = Math.round(hourValue * 60) + Math.max(0, minuteValue);
            return clamp(total);
        }

        Matcher clock = CLOCK.matcher(text);
        if (clock.matches()) {
            return clamp(parseInt(clock.group(1)) * 60L + parseInt(clock.group(2)));
        }

        String normalized = text.replace(',', '.');
        try {
            double number = Double.parseDouble(normalized);
            return fromNumber(number, normalized.contains("."));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static int fromNumber(double number, boolean decimal) {
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            return 0;
        }
        // "2.0" is written as hours as well, only integers are minutes
        if (decimal && Math.abs(number) <= MAX_DECIMAL_HOURS) {
            return clamp(Math.round(number * 60));
        }
        return clamp(Math.round(number));
    }

    private static double parseDecimal(String text) {
        try {
            return Double.parseDouble(text.replace(',', '.'));
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private static int parseInt(String text) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static int clamp(long minutes) {
        if (minutes <= 0) {
            return 0;
        }
        return (int) Math.min(Integer.MAX_VALUE, minutes);
    }
}
