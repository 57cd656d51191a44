package com.proximity.hotels.domain.model;

/**
 * Geographic and ranking constants shared by coordinate validation, distance math and
 * search scoring. Nothing else in the codebase should repeat these literals.
 */
public final class GeoConstants {

    public static final double MIN_LATITUDE = -90.0;
    public static final double MAX_LATITUDE = 90.0;
    public static final double MIN_LONGITUDE = -180.0;
    public static final double MAX_LONGITUDE = 180.0;

    /**
     * Mean Earth radius used by the Haversine formula.
     */
    public static final double EARTH_RADIUS_KM = 6371.0;

    /**
     * Approximate length of one degree of latitude. Slightly below the true value
     * (~111.19 km), so boxes derived from it err on the generous side.
     */
    public static final double KM_PER_DEGREE_LAT = 111.0;

    public static final double EARTH_CIRCUMFERENCE_KM = 40_075.0;

    /**
     * Radius used when a search does not specify one. Half the circumference is longer
     * than the antipodal great-circle distance, so no hotel is ever excluded.
     */
    public static final double DEFAULT_SEARCH_RADIUS_KM = EARTH_CIRCUMFERENCE_KM / 2;

    /**
     * Below this cosine of latitude a point is treated as sitting on a pole.
     */
    public static final double POLAR_COSINE_THRESHOLD = 0.0001;

    /**
     * Longitude half-width meaning "every longitude".
     */
    public static final double POLAR_LONGITUDE_RANGE = 180.0;

    public static final double PRICE_WEIGHT = 0.5;
    public static final double DISTANCE_WEIGHT = 0.5;

    public static final String LATITUDE_ERROR_MESSAGE = "Latitude must be between -90 and 90 degrees.";
    public static final String LONGITUDE_ERROR_MESSAGE = "Longitude must be between -180 and 180 degrees.";

    private GeoConstants() {
        // Utility class
    }

    public static boolean isValidLatitude(double latitude) {
        return latitude >= MIN_LATITUDE && latitude <= MAX_LATITUDE;
    }

    public static boolean isValidLongitude(double longitude) {
        return longitude >= MIN_LONGITUDE && longitude <= MAX_LONGITUDE;
    }
}
