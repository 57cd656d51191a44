package com.proximity.hotels.application.service;

import com.proximity.hotels.api.dto.HotelSearchResultDto;
import com.proximity.hotels.api.dto.PagedResultDto;
import com.proximity.hotels.application.mapper.HotelMapper;
import com.proximity.hotels.application.port.in.SearchHotelsUseCase;
import com.proximity.hotels.application.port.out.HotelRepository;
import com.proximity.hotels.domain.exception.OutOfRangeException;
import com.proximity.hotels.domain.model.Coordinates;
import com.proximity.hotels.domain.model.Hotel;
import com.proximity.hotels.domain.model.HotelSearchResult;
import com.proximity.hotels.domain.service.HotelSearchEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Application service for proximity search.
 * Strategy: Cache-first → rank the store snapshot → slice the page → populate cache
 */
@Service
public class HotelSearchService implements SearchHotelsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(HotelSearchService.class);

    private final HotelRepository hotelRepository;
    private final HotelSearchEngine searchEngine;
    private final HotelMapper hotelMapper;
    private final CacheManager cacheManager;
    private final SearchCacheGeneration cacheGeneration;
    private final int maxPageSize;

    public HotelSearchService(
            HotelRepository hotelRepository,
            HotelSearchEngine searchEngine,
            HotelMapper hotelMapper,
            CacheManager cacheManager,
            SearchCacheGeneration cacheGeneration,
            @Value("${app.search.max-page-size:100}") int maxPageSize) {
        this.hotelRepository = hotelRepository;
        this.searchEngine = searchEngine;
        this.hotelMapper = hotelMapper;
        this.cacheManager = cacheManager;
        this.cacheGeneration = cacheGeneration;
        this.maxPageSize = maxPageSize;
    }

    /**
     * Global search: no radius limit, every hotel is ranked.
     *
     * @param latitude  Query latitude
     * @param longitude Query longitude
     * @param page      1-based page number
     * @param pageSize  Items per page
     * @return Requested page; empty items and zero totals when the store is empty
     */
    @Override
    public PagedResultDto<HotelSearchResultDto> searchHotels(double latitude, double longitude, int page, int pageSize) {
        // Fail fast before touching cache or store
        Coordinates.of(latitude, longitude);
        validatePaging(page, pageSize);

        // Generation is read before the snapshot so the page is keyed no newer than its data
        String cacheKey = SearchCacheKeys.search(cacheGeneration.current(), latitude, longitude, page, pageSize);
        Optional<PagedResultDto<HotelSearchResultDto>> cached = getFromCache(cacheKey);
        if (cached.isPresent()) {
            logger.debug("Search cache hit for key: {}", cacheKey);
            return copyOf(cached.get());
        }
        logger.debug("Search cache miss for key: {}", cacheKey);

        List<Hotel> hotels = hotelRepository.findAll();
        if (hotels.isEmpty()) {
            return new PagedResultDto<>(List.of(), page, pageSize, 0, 0);
        }

        List<HotelSearchResult> ranked = searchEngine.search(hotels, latitude, longitude);

        int totalCount = ranked.size();
        int totalPages = (int) Math.ceil(totalCount / (double) pageSize);

        List<HotelSearchResultDto> items = ranked.stream()
                .skip((long) (page - 1) * pageSize)
                .limit(pageSize)
                .map(hotelMapper::toDto)
                .toList();

        PagedResultDto<HotelSearchResultDto> result =
                new PagedResultDto<>(items, page, pageSize, totalCount, totalPages);
        populateCache(cacheKey, copyOf(result));
        return result;
    }

    /**
     * Pages handed out and pages held by the cache never share mutable state.
     */
    private static PagedResultDto<HotelSearchResultDto> copyOf(PagedResultDto<HotelSearchResultDto> source) {
        List<HotelSearchResultDto> items = new ArrayList<>(source.getItems().size());
        for (HotelSearchResultDto item : source.getItems()) {
            items.add(new HotelSearchResultDto(
                    item.getId(), item.getName(), item.getPricePerNight(), item.getDistanceKm()));
        }
        return new PagedResultDto<>(items, source.getPage(), source.getPageSize(),
                source.getTotalCount(), source.getTotalPages());
    }

    private void validatePaging(int page, int pageSize) {
        if (page < 1) {
            throw new OutOfRangeException("page", page, "Page must be greater than 0.");
        }
        if (pageSize < 1 || pageSize > maxPageSize) {
            throw new OutOfRangeException("pageSize", pageSize,
                    "Page size must be between 1 and " + maxPageSize + ".");
        }
    }

    /**
     * Gracefully handles cache unavailability (e.g., Redis connection failures).
     */
    private Optional<PagedResultDto<HotelSearchResultDto>> getFromCache(String cacheKey) {
        try {
            Cache cache = cacheManager.getCache(SearchCacheKeys.SEARCH_CACHE);
            if (cache != null) {
                Cache.ValueWrapper wrapper = cache.get(cacheKey);
                if (wrapper != null && wrapper.get() instanceof PagedResultDto<?> cachedPage) {
                    @SuppressWarnings("unchecked")
                    PagedResultDto<HotelSearchResultDto> typed = (PagedResultDto<HotelSearchResultDto>) cachedPage;
                    return Optional.of(typed);
                }
            }
        } catch (Exception e) {
            logger.warn("Failed to read search cache, continuing without cache: {}", e.getMessage());
        }
        return Optional.empty();
    }

    private void populateCache(String cacheKey, PagedResultDto<HotelSearchResultDto> result) {
        try {
            Cache cache = cacheManager.getCache(SearchCacheKeys.SEARCH_CACHE);
            if (cache != null) {
                cache.put(cacheKey, result);
                logger.debug("Search cache populated for key: {}", cacheKey);
            }
        } catch (Exception e) {
            logger.warn("Failed to populate search cache, continuing without cache: {}", e.getMessage());
        }
    }
}
