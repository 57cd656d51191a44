package com.proximity.hotels.domain.model;

import com.proximity.hotels.domain.exception.InvalidArgumentException;
import com.proximity.hotels.domain.exception.OutOfRangeException;
import lombok.AccessLevel;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Aggregate root for a hotel that can be searched by proximity.
 *
 * Name and price invariants are enforced here; location invariants are delegated to
 * {@link Coordinates}. Instances are mutable through {@link #update} only.
 */
@Getter
public class Hotel {

    public static final int MAX_NAME_LENGTH = 200;
    public static final BigDecimal MIN_PRICE = new BigDecimal("0.01");
    public static final BigDecimal MAX_PRICE = new BigDecimal("100000000");

    private final UUID id;
    private String name;
    private BigDecimal pricePerNight;
    private Coordinates location;
    private final OffsetDateTime createdAt;

    @Getter(AccessLevel.NONE)
    private OffsetDateTime updatedAt;

    private Hotel(UUID id, String name, BigDecimal pricePerNight, Coordinates location,
            OffsetDateTime createdAt, OffsetDateTime updatedAt) {
        this.id = id;
        this.name = name;
        this.pricePerNight = pricePerNight;
        this.location = location;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    /**
     * Creates a new hotel with a generated ID, stamped with the current UTC time.
     */
    public static Hotel create(String name, BigDecimal pricePerNight, double latitude, double longitude) {
        return create(name, pricePerNight, latitude, longitude, Clock.systemUTC());
    }

    /**
     * Creates a new hotel with a generated ID, stamped with the given clock.
     *
     * @throws InvalidArgumentException if the name is blank or too long
     * @throws OutOfRangeException      if the price or coordinates are out of bounds
     */
    public static Hotel create(String name, BigDecimal pricePerNight, double latitude, double longitude,
            Clock clock) {
        validateName(name);
        validatePrice(pricePerNight);
        Coordinates location = Coordinates.of(latitude, longitude);

        return new Hotel(UUID.randomUUID(), name.trim(), pricePerNight, location,
                OffsetDateTime.now(clock), null);
    }

    /**
     * Rebuilds a hotel whose identity and timestamps come from an external store.
     * Field validation still applies.
     */
    public static Hotel createWithIdentity(UUID id, String name, BigDecimal pricePerNight,
            double latitude, double longitude, OffsetDateTime createdAt, Optional<OffsetDateTime> updatedAt) {
        if (id == null) {
            throw new InvalidArgumentException("id", "Hotel ID must not be null.");
        }
        if (createdAt == null) {
            throw new InvalidArgumentException("createdAt", "Creation timestamp must not be null.");
        }
        validateName(name);
        validatePrice(pricePerNight);
        Coordinates location = Coordinates.of(latitude, longitude);

        return new Hotel(id, name.trim(), pricePerNight, location, createdAt, updatedAt.orElse(null));
    }

    public void update(String name, BigDecimal pricePerNight, double latitude, double longitude) {
        update(name, pricePerNight, latitude, longitude, Clock.systemUTC());
    }

    /**
     * Replaces every mutable field after validating all of them. Nothing changes if any
     * value is rejected.
     */
    public void update(String name, BigDecimal pricePerNight, double latitude, double longitude, Clock clock) {
        validateName(name);
        validatePrice(pricePerNight);
        Coordinates newLocation = Coordinates.of(latitude, longitude);

        this.name = name.trim();
        this.pricePerNight = pricePerNight;
        this.location = newLocation;
        this.updatedAt = OffsetDateTime.now(clock);
    }

    public Optional<OffsetDateTime> getUpdatedAt() {
        return Optional.ofNullable(updatedAt);
    }

    public double distanceTo(Coordinates coordinates) {
        return location.distanceTo(coordinates);
    }

    /**
     * Detached copy with identical state, used by stores that must not share instances
     * with their callers.
     */
    public Hotel snapshot() {
        return new Hotel(id, name, pricePerNight, location, createdAt, updatedAt);
    }

    private static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("name", "Hotel name cannot be empty.");
        }
        if (name.trim().length() > MAX_NAME_LENGTH) {
            throw new InvalidArgumentException("name",
                    "Hotel name cannot exceed " + MAX_NAME_LENGTH + " characters.");
        }
    }

    private static void validatePrice(BigDecimal pricePerNight) {
        if (pricePerNight == null) {
            throw new InvalidArgumentException("pricePerNight", "Price per night is required.");
        }
        if (pricePerNight.compareTo(MIN_PRICE) < 0) {
            throw new OutOfRangeException("pricePerNight", pricePerNight,
                    "Price per night must be at least " + MIN_PRICE + ".");
        }
        if (pricePerNight.compareTo(MAX_PRICE) > 0) {
            throw new OutOfRangeException("pricePerNight", pricePerNight,
                    "Price per night cannot exceed " + MAX_PRICE.toPlainString() + ".");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Hotel other)) {
            return false;
        }
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Hotel(id=" + id + ", name=" + name + ", pricePerNight=" + pricePerNight
                + ", location=" + location + ")";
    }
}
