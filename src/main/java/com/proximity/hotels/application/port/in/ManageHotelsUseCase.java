package com.proximity.hotels.application.port.in;

import com.proximity.hotels.api.dto.HotelRequestDto;
import com.proximity.hotels.api.dto.HotelResponseDto;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Input port for creating, reading, updating and deleting hotels.
 */
public interface ManageHotelsUseCase {

  HotelResponseDto createHotel(HotelRequestDto request);

  Optional<HotelResponseDto> getHotel(UUID id);

  List<HotelResponseDto> getAllHotels();

  /**
   * @throws com.proximity.hotels.domain.exception.HotelNotFoundException if the hotel does not exist
   */
  HotelResponseDto updateHotel(UUID id, HotelRequestDto request);

  /**
   * @throws com.proximity.hotels.domain.exception.HotelNotFoundException if the hotel does not exist
   */
  void deleteHotel(UUID id);
}
