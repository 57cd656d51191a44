package com.proximity.hotels.application.service;

import com.proximity.hotels.api.dto.HotelRequestDto;
import com.proximity.hotels.api.dto.HotelResponseDto;
import com.proximity.hotels.application.mapper.HotelMapper;
import com.proximity.hotels.application.port.in.ManageHotelsUseCase;
import com.proximity.hotels.application.port.out.HotelRepository;
import com.proximity.hotels.domain.exception.HotelNotFoundException;
import com.proximity.hotels.domain.exception.InvalidArgumentException;
import com.proximity.hotels.domain.model.Hotel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Application service for hotel CRUD.
 * Every successful mutation clears the search cache so rankings never go stale.
 */
@Service
public class HotelManagementService implements ManageHotelsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(HotelManagementService.class);

    private final HotelRepository hotelRepository;
    private final HotelMapper hotelMapper;
    private final CacheManager cacheManager;
    private final SearchCacheGeneration cacheGeneration;
    private final Clock clock;

    public HotelManagementService(
            HotelRepository hotelRepository,
            HotelMapper hotelMapper,
            CacheManager cacheManager,
            SearchCacheGeneration cacheGeneration,
            Clock clock) {
        this.hotelRepository = hotelRepository;
        this.hotelMapper = hotelMapper;
        this.cacheManager = cacheManager;
        this.cacheGeneration = cacheGeneration;
        this.clock = clock;
    }

    @Override
    public HotelResponseDto createHotel(HotelRequestDto request) {
        Hotel hotel = Hotel.create(
                request.getName(),
                request.getPricePerNight(),
                required(request.getLatitude(), "latitude"),
                required(request.getLongitude(), "longitude"),
                clock);

        Hotel created = hotelRepository.add(hotel);
        logger.info("Created hotel {} ({})", created.getId(), created.getName());

        evictSearchCache();
        return hotelMapper.toDto(created);
    }

    @Override
    public Optional<HotelResponseDto> getHotel(UUID id) {
        return hotelRepository.findById(id).map(hotelMapper::toDto);
    }

    @Override
    public List<HotelResponseDto> getAllHotels() {
        return hotelRepository.findAll().stream()
                .map(hotelMapper::toDto)
                .toList();
    }

    @Override
    public HotelResponseDto updateHotel(UUID id, HotelRequestDto request) {
        Hotel hotel = hotelRepository.findById(id)
                .orElseThrow(() -> new HotelNotFoundException(id));

        // The repository hands out detached copies, so this mutation is invisible to
        // readers until update() swaps it in
        hotel.update(
                request.getName(),
                request.getPricePerNight(),
                required(request.getLatitude(), "latitude"),
                required(request.getLongitude(), "longitude"),
                clock);

        Hotel updated = hotelRepository.update(hotel);
        logger.info("Updated hotel {}", updated.getId());

        evictSearchCache();
        return hotelMapper.toDto(updated);
    }

    @Override
    public void deleteHotel(UUID id) {
        if (!hotelRepository.delete(id)) {
            throw new HotelNotFoundException(id);
        }
        logger.info("Deleted hotel {}", id);
        evictSearchCache();
    }

    private static double required(Double value, String argument) {
        if (value == null) {
            throw new InvalidArgumentException(argument, "The " + argument + " field is required.");
        }
        return value;
    }

    /**
     * Runs after the store write. Advancing the generation retires every existing key,
     * including ones a search still in flight is about to fill; clearing frees the memory.
     * Gracefully handles cache unavailability (e.g., Redis connection failures).
     */
    private void evictSearchCache() {
        long generation = cacheGeneration.advance();
        logger.debug("Search cache generation advanced to {}", generation);
        try {
            Cache cache = cacheManager.getCache(SearchCacheKeys.SEARCH_CACHE);
            if (cache != null) {
                cache.clear();
                logger.debug("Search cache cleared");
            }
        } catch (Exception e) {
            logger.warn("Failed to clear search cache: {}", e.getMessage());
        }
    }
}
