package com.proximity.hotels.infrastructure.persistence;

import com.proximity.hotels.application.port.out.HotelRepository;
import com.proximity.hotels.domain.exception.HotelConflictException;
import com.proximity.hotels.domain.exception.HotelNotFoundException;
import com.proximity.hotels.domain.model.Hotel;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of the HotelRepository output port.
 *
 * Every write is a single atomic map operation. Stored hotels are private copies and
 * reads return fresh copies, so a caller mutating a hotel can never be observed halfway
 * by another thread. Data lives for the lifetime of the process only.
 */
@Repository
public class InMemoryHotelRepository implements HotelRepository {

    private final ConcurrentMap<UUID, Hotel> hotels = new ConcurrentHashMap<>();

    @Override
    public Optional<Hotel> findById(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(hotels.get(id)).map(Hotel::snapshot);
    }

    @Override
    public List<Hotel> findAll() {
        return hotels.values().stream()
                .map(Hotel::snapshot)
                .toList();
    }

    @Override
    public Hotel add(Hotel hotel) {
        Objects.requireNonNull(hotel, "hotel must not be null");

        Hotel stored = hotel.snapshot();
        if (hotels.putIfAbsent(stored.getId(), stored) != null) {
            throw new HotelConflictException(stored.getId());
        }
        return stored.snapshot();
    }

    @Override
    public Hotel update(Hotel hotel) {
        Objects.requireNonNull(hotel, "hotel must not be null");

        Hotel stored = hotel.snapshot();
        if (hotels.computeIfPresent(stored.getId(), (id, previous) -> stored) == null) {
            throw new HotelNotFoundException(stored.getId());
        }
        return stored.snapshot();
    }

    @Override
    public boolean delete(UUID id) {
        return id != null && hotels.remove(id) != null;
    }

    @Override
    public boolean exists(UUID id) {
        return id != null && hotels.containsKey(id);
    }

    @Override
    public long count() {
        return hotels.size();
    }
}
