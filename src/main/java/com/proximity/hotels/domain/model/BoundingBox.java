package com.proximity.hotels.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Latitude/longitude rectangle used to discard far-away hotels before exact distance
 * checks. When {@code minLon > maxLon} the box straddles the antimeridian.
 */
@Getter
@EqualsAndHashCode
@ToString
public class BoundingBox {
    private final double minLat;
    private final double maxLat;
    private final double minLon;
    private final double maxLon;

    public BoundingBox(double minLat, double maxLat, double minLon, double maxLon) {
        if (minLat > maxLat) {
            throw new IllegalArgumentException("minLat must not exceed maxLat");
        }
        this.minLat = minLat;
        this.maxLat = maxLat;
        this.minLon = minLon;
        this.maxLon = maxLon;
    }

    public boolean crossesAntimeridian() {
        return minLon > maxLon;
    }

    public boolean contains(Coordinates point) {
        double lat = point.getLatitude();
        double lon = point.getLongitude();

        if (lat < minLat || lat > maxLat) {
            return false;
        }
        if (crossesAntimeridian()) {
            return lon >= minLon || lon <= maxLon;
        }
        return lon >= minLon && lon <= maxLon;
    }
}
