package com.event.resolution.location;

import com.event.resolution.core.model.LocationQuery;

/**
 * A {@link LocationQuery} with every field in normalized form.
 *
 * @param location    normalized location
 * @param sublocation normalized sublocation
 * @param name        normalized event name
 * @param combined    {@code location + " " + sublocation}, stripped
 */
record NormalizedQuery(String location, String sublocation, String name, String combined) {

    static NormalizedQuery of(LocationQuery query) {
        String location = LocationNameNormalizer.normalize(query.location());
        String sublocation = LocationNameNormalizer.normalize(query.sublocation());
        String name = LocationNameNormalizer.normalize(query.eventName());
        return new NormalizedQuery(location, sublocation, name, (location + " " + sublocation).strip());
    }
}
