package com.event.resolution.core.model;

/**
 * The {@code {lat, lng, emoji}} projection of a {@link LocationEntry}, as stored in the
 * location index and attached to resolved events.
 *
 * @param lat   latitude, may be null when the registry entry has none
 * @param lng   longitude, may be null when the registry entry has none
 * @param emoji venue emoji, may be null
 */
public record LocationMatch(Double lat, Double lng, String emoji) {
}
