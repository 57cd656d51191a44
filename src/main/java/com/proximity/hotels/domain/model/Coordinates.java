package com.proximity.hotels.domain.model;

import com.proximity.hotels.domain.exception.OutOfRangeException;
import lombok.Getter;

import java.util.Locale;
import java.util.Objects;

/**
 * Value object representing a validated geographic coordinate pair in degrees.
 *
 * Equality is tolerant: two coordinates are equal when both components differ by at most
 * {@link #EQUALITY_TOLERANCE}. The hash code is computed from both components snapped to
 * that same grid so that equal values hash alike.
 */
@Getter
public final class Coordinates {

    public static final double EQUALITY_TOLERANCE = 1e-7;

    private static final double QUANTIZATION_SCALE = 1.0 / EQUALITY_TOLERANCE;

    private final double latitude;
    private final double longitude;

    private Coordinates(double latitude, double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
    }

    /**
     * Creates a coordinate after validating both components.
     *
     * @param latitude  Latitude in [-90, 90]
     * @param longitude Longitude in [-180, 180]
     * @return Validated coordinate
     * @throws OutOfRangeException if a component is out of bounds, NaN or infinite
     */
    public static Coordinates of(double latitude, double longitude) {
        if (!Double.isFinite(latitude)) {
            throw new OutOfRangeException("latitude", latitude, "Latitude must be a finite number.");
        }
        if (!Double.isFinite(longitude)) {
            throw new OutOfRangeException("longitude", longitude, "Longitude must be a finite number.");
        }
        if (!GeoConstants.isValidLatitude(latitude)) {
            throw new OutOfRangeException("latitude", latitude, GeoConstants.LATITUDE_ERROR_MESSAGE);
        }
        if (!GeoConstants.isValidLongitude(longitude)) {
            throw new OutOfRangeException("longitude", longitude, GeoConstants.LONGITUDE_ERROR_MESSAGE);
        }
        return new Coordinates(latitude, longitude);
    }

    /**
     * Great-circle distance to another coordinate.
     *
     * @param destination Other coordinate, never null
     * @return Distance in kilometers
     */
    public double distanceTo(Coordinates destination) {
        Objects.requireNonNull(destination, "destination must not be null");

        if (this == destination) {
            return 0.0;
        }
        return haversineKm(latitude, longitude, destination.latitude, destination.longitude);
    }

    /**
     * Haversine distance between two points given in degrees. Callers are expected to pass
     * coordinates that were already validated.
     */
    public static double haversineKm(double originLat, double originLon, double destinationLat, double destinationLon) {
        double originLatRad = Math.toRadians(originLat);
        double destinationLatRad = Math.toRadians(destinationLat);
        double deltaLat = Math.toRadians(destinationLat - originLat);
        double deltaLon = Math.toRadians(destinationLon - originLon);

        double sinDeltaLatHalf = Math.sin(deltaLat / 2);
        double sinDeltaLonHalf = Math.sin(deltaLon / 2);

        double a = sinDeltaLatHalf * sinDeltaLatHalf
                + Math.cos(originLatRad) * Math.cos(destinationLatRad) * sinDeltaLonHalf * sinDeltaLonHalf;

        // Rounding can push a slightly outside [0, 1], which turns sqrt(1 - a) into NaN
        a = Math.max(0.0, Math.min(1.0, a));

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return GeoConstants.EARTH_RADIUS_KM * c;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Coordinates other)) {
            return false;
        }
        return Math.abs(latitude - other.latitude) <= EQUALITY_TOLERANCE
                && Math.abs(longitude - other.longitude) <= EQUALITY_TOLERANCE;
    }

    @Override
    public int hashCode() {
        long latQuant = (long) Math.rint(latitude * QUANTIZATION_SCALE);
        long lonQuant = (long) Math.rint(longitude * QUANTIZATION_SCALE);
        return Objects.hash(latQuant, lonQuant);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(%.7f, %.7f)", latitude, longitude);
    }
}
