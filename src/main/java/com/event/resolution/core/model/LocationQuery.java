package com.event.resolution.core.model;

/**
 * Raw venue text of one row plus the context the matcher may fall back on.
 * Null fields are treated as empty.
 *
 * @param location       location cell
 * @param sublocation    sublocation cell
 * @param sourceSiteName site name derived from the source file name
 * @param eventName      event name, which sometimes is the venue itself
 */
public record LocationQuery(String location, String sublocation, String sourceSiteName, String eventName) {

    public LocationQuery {
        location = location != null ? location.strip() : "";
        sublocation = sublocation != null ? sublocation.strip() : "";
        sourceSiteName = sourceSiteName != null ? sourceSiteName : "";
        eventName = eventName != null ? eventName.strip() : "";
    }

    public static LocationQuery of(String location, String sublocation) {
        return new LocationQuery(location, sublocation, "", "");
    }

    /**
     * Describes the raw venue text for unresolved-location log lines.
     */
    public String describe() {
        return sublocation.isEmpty() ? "'" + location + "'" : "'" + location + "' / '" + sublocation + "'";
    }
}
