package com.proximity.hotels.module.test.support;

import com.proximity.hotels.api.dto.HotelRequestDto;
import com.proximity.hotels.domain.model.Hotel;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

/**
 * Test fixtures for creating test data.
 * Provides factory methods for common test scenarios.
 */
public class TestFixtures {

    private TestFixtures() {
        // Utility class
    }

    /**
     * Clock frozen at {@link Common#NOW}.
     */
    public static Clock fixedClock() {
        return Clock.fixed(Common.NOW.toInstant(), ZoneOffset.UTC);
    }

    /**
     * Create a test hotel with a generated ID.
     */
    public static Hotel hotel(String name, String price, double lat, double lng) {
        return Hotel.create(name, new BigDecimal(price), lat, lng, fixedClock());
    }

    /**
     * Create a test hotel with a fixed ID, handy for deterministic ordering checks.
     */
    public static Hotel hotel(UUID id, String name, String price, double lat, double lng) {
        return Hotel.createWithIdentity(id, name, new BigDecimal(price), lat, lng, Common.NOW, Optional.empty());
    }

    /**
     * Create a test hotel request DTO.
     */
    public static HotelRequestDto hotelRequest(String name, String price, double lat, double lng) {
        return new HotelRequestDto(name, new BigDecimal(price), lat, lng);
    }

    /**
     * Deterministic UUID whose ordering follows {@code n}.
     */
    public static UUID uuid(long n) {
        return new UUID(0L, n);
    }

    /**
     * Common test coordinates.
     */
    public static class Coordinates {
        public static final double ZAGREB_LAT = 45.815;
        public static final double ZAGREB_LNG = 15.982;
        public static final double VIENNA_LAT = 48.208;
        public static final double VIENNA_LNG = 16.373;
        public static final double PARIS_LAT = 48.8566;
        public static final double PARIS_LNG = 2.3522;
    }

    /**
     * Common test data.
     */
    public static class Common {
        public static final String ADMIN_TOKEN = "test-admin-token";
        public static final OffsetDateTime NOW =
                OffsetDateTime.ofInstant(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);
    }
}
