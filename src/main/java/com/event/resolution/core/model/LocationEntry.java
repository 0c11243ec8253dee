package com.event.resolution.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical venue from the location registry.
 * Reference data loaded once per run. Registry fields this class does not model
 * are kept so that exported location subsets reproduce the registry entry.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "alternate_names", "lat", "lng", "emoji"})
public final class LocationEntry {

    private final String name;
    private final List<String> alternateNames;
    private final Double lat;
    private final Double lng;
    private final String emoji;
    private final Map<String, Object> extraFields = new LinkedHashMap<>();

    @JsonCreator
    public LocationEntry(@JsonProperty("name") String name,
                         @JsonProperty("alternate_names") List<String> alternateNames,
                         @JsonProperty("lat") Double lat,
                         @JsonProperty("lng") Double lng,
                         @JsonProperty("emoji") String emoji) {
        this.name = name != null ? name : "";
        this.alternateNames = alternateNames != null
                ? alternateNames.stream().filter(Objects::nonNull).toList()
                : List.of();
        this.lat = lat;
        this.lng = lng;
        this.emoji = emoji;
    }

    public static LocationEntry of(String name, double lat, double lng, String... alternateNames) {
        return new LocationEntry(name, List.of(alternateNames), lat, lng, null);
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("alternate_names")
    public List<String> getAlternateNames() {
        return alternateNames;
    }

    @JsonProperty("lat")
    public Double getLat() {
        return lat;
    }

    @JsonProperty("lng")
    public Double getLng() {
        return lng;
    }

    @JsonProperty("emoji")
    public String getEmoji() {
        return emoji;
    }

    public boolean hasCoordinates() {
        return lat != null && lng != null;
    }

    /**
     * Projection stored in the location index.
     */
    public LocationMatch toMatch() {
        return new LocationMatch(lat, lng, emoji);
    }

    @JsonAnyGetter
    public Map<String, Object> getExtraFields() {
        return Collections.unmodifiableMap(extraFields);
    }

    @JsonAnySetter
    void putExtraField(String key, Object value) {
        extraFields.put(key, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LocationEntry that = (LocationEntry) o;
        return name.equals(that.name) && Objects.equals(lat, that.lat) && Objects.equals(lng, that.lng);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, lat, lng);
    }

    @Override
    public String toString() {
        return "LocationEntry{name='" + name + "', lat=" + lat + ", lng=" + lng + '}';
    }
}
