package com.proximity.hotels.application.port.out;

import com.proximity.hotels.domain.exception.HotelConflictException;
import com.proximity.hotels.domain.exception.HotelNotFoundException;
import com.proximity.hotels.domain.model.Hotel;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Output port for hotel storage.
 * Implementations must be safe for concurrent use.
 */
public interface HotelRepository {

  /**
   * Find a hotel by ID. A missing ID yields an empty result, never an exception.
   */
  Optional<Hotel> findById(UUID id);

  /**
   * Point-in-time snapshot of every stored hotel. Order carries no meaning.
   */
  List<Hotel> findAll();

  /**
   * Store a new hotel.
   *
   * @throws HotelConflictException if a hotel with the same ID is already stored
   */
  Hotel add(Hotel hotel);

  /**
   * Replace a stored hotel.
   *
   * @throws HotelNotFoundException if no hotel with that ID is stored
   */
  Hotel update(Hotel hotel);

  /**
   * Remove a hotel.
   *
   * @return true if a hotel was removed, false if none was stored under the ID
   */
  boolean delete(UUID id);

  boolean exists(UUID id);

  long count();
}
