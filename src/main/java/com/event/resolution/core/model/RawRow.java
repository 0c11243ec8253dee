package com.event.resolution.core.model;

import java.util.List;

/**
 * One parsed table line. All fields are strings and any may be empty.
 * Ephemeral: consumed as soon as it is merged into an {@link Event}.
 */
public record RawRow(
        String name,
        String location,
        String sublocation,
        String startDate,
        String startTime,
        String endDate,
        String endTime,
        String description,
        String url,
        String hashtags,
        String emoji
) {
    /**
     * Canonical column order of the extraction table.
     */
    public static final List<String> COLUMNS = List.of(
            "name", "location", "sublocation", "start_date", "start_time",
            "end_date", "end_time", "description", "url", "hashtags", "emoji");

    public RawRow {
        name = orEmpty(name);
        location = orEmpty(location);
        sublocation = orEmpty(sublocation);
        startDate = orEmpty(startDate);
        startTime = orEmpty(startTime);
        endDate = orEmpty(endDate);
        endTime = orEmpty(endTime);
        description = orEmpty(description);
        url = orEmpty(url);
        hashtags = orEmpty(hashtags);
        emoji = orEmpty(emoji);
    }

    /**
     * Builds a row from cells in {@link #COLUMNS} order. Missing trailing cells become empty.
     */
    public static RawRow fromCells(List<String> cells) {
        String[] v = new String[COLUMNS.size()];
        for (int i = 0; i < v.length; i++) {
            v[i] = i < cells.size() ? cells.get(i) : "";
        }
        return new RawRow(v[0], v[1], v[2], v[3], v[4], v[5], v[6], v[7], v[8], v[9], v[10]);
    }

    /**
     * Returns a copy with the free-text fields replaced.
     */
    public RawRow withText(String newName, String newLocation, String newSublocation, String newDescription) {
        return new RawRow(newName, newLocation, newSublocation, startDate, startTime, endDate, endTime,
                newDescription, url, hashtags, emoji);
    }

    private static String orEmpty(String s) {
        return s != null ? s : "";
    }
}
