package com.event.resolution.text;

import java.util.Locale;

/**
 * Standardizes free-form times: {@code "6:30 P.M."} becomes {@code "6:30pm"},
 * {@code "6:00 PM"} becomes {@code "6pm"}, {@code "All Day"} becomes empty.
 */
public final class TimeStandardizer {

    private TimeStandardizer() {
    }

    public static String standardize(String time) {
        if (time == null || time.isEmpty()) {
            return "";
        }
        String normalized = time.toLowerCase(Locale.ROOT).replace(" ", "").replace(".", "");
        if (normalized.equals("allday")) {
            return "";
        }
        return normalized.replace(":00", "");
    }
}
