package com.proximity.hotels.application.port.in;

import com.proximity.hotels.api.dto.HotelSearchResultDto;
import com.proximity.hotels.api.dto.PagedResultDto;

/**
 * Input port for proximity search.
 * Defines the use case interface for the hotel search service.
 */
public interface SearchHotelsUseCase {

  /**
   * Rank every hotel by price and distance from the query point and return one page.
   *
   * @param latitude  Query latitude
   * @param longitude Query longitude
   * @param page      1-based page number
   * @param pageSize  Items per page, 1 to the configured maximum
   * @return Requested page with total counts
   */
  PagedResultDto<HotelSearchResultDto> searchHotels(double latitude, double longitude, int page, int pageSize);
}
