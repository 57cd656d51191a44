package com.proximity.hotels.application.service;

import com.proximity.hotels.infrastructure.cache.CacheConfig;

import java.util.Locale;

/**
 * Cache names and keys shared by the search and hotel management services.
 */
final class SearchCacheKeys {

    static final String SEARCH_CACHE = CacheConfig.SEARCH_CACHE;

    private static final String SEARCH_PREFIX = "search:";

    private SearchCacheKeys() {
        // Utility class
    }

    /**
     * Coordinates are rounded to 4 decimals (~11 m) so nearby queries share an entry.
     */
    static String search(long generation, double latitude, double longitude, int page, int pageSize) {
        return String.format(Locale.ROOT, "%s%d:%.4f:%.4f:%d:%d",
                SEARCH_PREFIX, generation, latitude, longitude, page, pageSize);
    }
}
