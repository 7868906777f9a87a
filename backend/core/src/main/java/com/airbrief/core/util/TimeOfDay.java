package com.airbrief.core.util;

import java.time.LocalTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strict 24-hour {@code HH:MM} times as stored in alert preferences.
 */
public final class TimeOfDay {
    private static final Pattern HH_MM = Pattern.compile("([01]\\d|2[0-3]):([0-5]\\d)");

    private TimeOfDay() {
    }

    public static Optional<LocalTime> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        Matcher matcher = HH_MM.matcher(value.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(LocalTime.of(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2))));
    }

    public static LocalTime parseOrThrow(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Time must be HH:MM, got: " + value));
    }

    public static String format(LocalTime time) {
        return String.format("%02d:%02d", time.getHour(), time.getMinute());
    }
}
