package com.event.resolution.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSetter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Canonical resolved event record.
 * Core domain object for event resolution: one logical activity with one or more occurrences.
 *
 * <p>Invariants: {@code lat}/{@code lng} are either both present or both absent;
 * {@code urls}, {@code tags} and {@code occurrences} never contain duplicates and keep
 * insertion order.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"name", "short_name", "location", "sublocation", "description",
        "urls", "tags", "emoji", "lat", "lng", "occurrences"})
public class Event {

    @JsonProperty("name")
    private String name;
    @JsonProperty("short_name")
    private String shortName;
    @JsonProperty("location")
    private String location;
    @JsonProperty("sublocation")
    private String sublocation;
    @JsonProperty("description")
    private String description;
    @JsonProperty("urls")
    private List<String> urls = new ArrayList<>();
    @JsonProperty("tags")
    private List<String> tags = new ArrayList<>();
    @JsonProperty("emoji")
    private String emoji;
    @JsonProperty("lat")
    private Double lat;
    @JsonProperty("lng")
    private Double lng;
    @JsonProperty("occurrences")
    private List<Occurrence> occurrences = new ArrayList<>();

    public Event() {
    }

    private Event(Builder builder) {
        this.name = builder.name;
        this.shortName = builder.shortName;
        this.location = builder.location;
        this.sublocation = builder.sublocation;
        this.description = builder.description;
        setEmoji(builder.emoji);
        setCoordinates(builder.lat, builder.lng);
        builder.urls.forEach(this::addUrl);
        builder.tags.forEach(this::addTag);
        builder.occurrences.forEach(this::addOccurrence);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getShortName() {
        return shortName;
    }

    public void setShortName(String shortName) {
        this.shortName = shortName;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public String getSublocation() {
        return sublocation;
    }

    public void setSublocation(String sublocation) {
        this.sublocation = sublocation;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<String> getUrls() {
        return Collections.unmodifiableList(urls);
    }

    /**
     * Appends a URL if it is non-blank and not already present.
     *
     * @return true if the URL was added
     */
    public boolean addUrl(String url) {
        if (url == null || url.isBlank() || urls.contains(url)) {
            return false;
        }
        return urls.add(url);
    }

    /**
     * Replaces the URL list, dropping blanks and duplicates.
     */
    public void setUrls(List<String> newUrls) {
        urls = new ArrayList<>();
        if (newUrls != null) {
            newUrls.forEach(this::addUrl);
        }
    }

    public List<String> getTags() {
        return Collections.unmodifiableList(tags);
    }

    public boolean addTag(String tag) {
        if (tag == null || tag.isEmpty() || tags.contains(tag)) {
            return false;
        }
        return tags.add(tag);
    }

    public String getEmoji() {
        return emoji;
    }

    public void setEmoji(String emoji) {
        this.emoji = emoji == null || emoji.isEmpty() ? null : emoji;
    }

    public Double getLat() {
        return lat;
    }

    public Double getLng() {
        return lng;
    }

    /**
     * Sets both coordinates at once, or clears both when given two nulls.
     */
    public void setCoordinates(Double lat, Double lng) {
        if ((lat == null) != (lng == null)) {
            throw new IllegalArgumentException("lat and lng must both be present or both be absent");
        }
        this.lat = lat;
        this.lng = lng;
    }

    public boolean hasCoordinates() {
        return lat != null && lng != null;
    }

    public List<Occurrence> getOccurrences() {
        return Collections.unmodifiableList(occurrences);
    }

    /**
     * Appends an occurrence unless an equal tuple is already listed.
     *
     * @return true if the occurrence was added
     */
    public boolean addOccurrence(Occurrence occurrence) {
        if (occurrence == null || occurrences.contains(occurrence)) {
            return false;
        }
        return occurrences.add(occurrence);
    }

    /**
     * Returns the start date of the first occurrence, if any.
     */
    public Optional<String> firstStartDate() {
        if (occurrences.isEmpty() || !occurrences.get(0).hasStartDate()) {
            return Optional.empty();
        }
        return Optional.of(occurrences.get(0).startDate());
    }

    @JsonSetter("url")
    private void setLegacyUrl(String url) {
        addUrl(url != null ? url.strip() : null);
    }

    @Override
    public String toString() {
        return "Event{" +
                "name='" + name + '\'' +
                ", location='" + location + '\'' +
                ", occurrences=" + occurrences.size() +
                ", lat=" + lat +
                ", lng=" + lng +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String shortName;
        private String location;
        private String sublocation;
        private String description;
        private String emoji;
        private Double lat;
        private Double lng;
        private final List<String> urls = new ArrayList<>();
        private final List<String> tags = new ArrayList<>();
        private final List<Occurrence> occurrences = new ArrayList<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder shortName(String shortName) {
            this.shortName = shortName;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder sublocation(String sublocation) {
            this.sublocation = sublocation;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder emoji(String emoji) {
            this.emoji = emoji;
            return this;
        }

        public Builder coordinates(double lat, double lng) {
            this.lat = lat;
            this.lng = lng;
            return this;
        }

        public Builder url(String url) {
            this.urls.add(url);
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags.addAll(tags);
            return this;
        }

        public Builder occurrence(Occurrence occurrence) {
            this.occurrences.add(occurrence);
            return this;
        }

        public Builder occurrence(String startDate, String startTime, String endDate, String endTime) {
            return occurrence(new Occurrence(startDate, startTime, endDate, endTime));
        }

        public Event build() {
            if (occurrences.isEmpty()) {
                throw new IllegalArgumentException("An event needs at least one occurrence");
            }
            return new Event(this);
        }
    }
}
