package com.event.resolution.export;

/**
 * Inclusive latitude/longitude rectangle.
 */
public record BoundingBox(double minLat, double maxLat, double minLng, double maxLng) {

    public BoundingBox {
        if (minLat > maxLat) {
            throw new IllegalArgumentException("minLat must be <= maxLat");
        }
        if (minLng > maxLng) {
            throw new IllegalArgumentException("minLng must be <= maxLng");
        }
    }

    /**
     * Lower Manhattan and the adjacent part of Brooklyn.
     */
    public static BoundingBox lowerManhattan() {
        return new BoundingBox(40.686695, 40.749285, -74.014855, -73.959385);
    }

    public boolean contains(double lat, double lng) {
        return lat >= minLat && lat <= maxLat && lng >= minLng && lng <= maxLng;
    }
}
