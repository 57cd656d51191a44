package com.proximity.hotels.application.mapper;

import com.proximity.hotels.api.dto.HotelResponseDto;
import com.proximity.hotels.api.dto.HotelSearchResultDto;
import com.proximity.hotels.domain.model.Hotel;
import com.proximity.hotels.domain.model.HotelSearchResult;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Mapper for converting between domain models and DTOs.
 */
@Component
public class HotelMapper {

  private static final int DISTANCE_SCALE = 2;

  public HotelResponseDto toDto(Hotel hotel) {
    return new HotelResponseDto(
        hotel.getId(),
        hotel.getName(),
        hotel.getPricePerNight(),
        hotel.getLocation().getLatitude(),
        hotel.getLocation().getLongitude(),
        hotel.getCreatedAt(),
        hotel.getUpdatedAt().orElse(null));
  }

  /**
   * Maps a ranked result, rounding the distance for presentation.
   */
  public HotelSearchResultDto toDto(HotelSearchResult result) {
    Hotel hotel = result.getHotel();
    return new HotelSearchResultDto(
        hotel.getId(),
        hotel.getName(),
        hotel.getPricePerNight(),
        roundDistance(result.getDistanceKm()));
  }

  static double roundDistance(double distanceKm) {
    return BigDecimal.valueOf(distanceKm)
        .setScale(DISTANCE_SCALE, RoundingMode.HALF_UP)
        .doubleValue();
  }
}
