package com.proximity.hotels.application.service;

import com.proximity.hotels.api.dto.HotelRequestDto;
import com.proximity.hotels.api.dto.HotelResponseDto;
import com.proximity.hotels.application.mapper.HotelMapper;
import com.proximity.hotels.domain.exception.HotelNotFoundException;
import com.proximity.hotels.domain.exception.InvalidArgumentException;
import com.proximity.hotels.domain.exception.OutOfRangeException;
import com.proximity.hotels.infrastructure.cache.CacheConfig;
import com.proximity.hotels.infrastructure.persistence.InMemoryHotelRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.cache.Cache;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;

import java.math.BigDecimal;
import java.util.UUID;

import static com.proximity.hotels.module.test.support.TestFixtures.Common;
import static com.proximity.hotels.module.test.support.TestFixtures.Coordinates.*;
import static com.proximity.hotels.module.test.support.TestFixtures.fixedClock;
import static com.proximity.hotels.module.test.support.TestFixtures.hotelRequest;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HotelManagementServiceTest {

    private InMemoryHotelRepository repository;
    private Cache searchCache;
    private SearchCacheGeneration cacheGeneration;
    private HotelManagementService managementService;

    @BeforeEach
    void setUp() {
        repository = new InMemoryHotelRepository();
        ConcurrentMapCacheManager cacheManager = new ConcurrentMapCacheManager(CacheConfig.SEARCH_CACHE);
        searchCache = cacheManager.getCache(CacheConfig.SEARCH_CACHE);
        cacheGeneration = new SearchCacheGeneration();
        managementService = new HotelManagementService(
                repository, new HotelMapper(), cacheManager, cacheGeneration, fixedClock());
    }

    @Test
    void testCreateHotel_Valid_StoresAndStampsCreation() {
        HotelResponseDto created = managementService.createHotel(
                hotelRequest("  Esplanade  ", "180.50", ZAGREB_LAT, ZAGREB_LNG));

        assertThat(created.getId()).isNotNull();
        assertThat(created.getName()).isEqualTo("Esplanade");
        assertThat(created.getPricePerNight()).isEqualByComparingTo("180.50");
        assertThat(created.getCreatedAt()).isEqualTo(Common.NOW);
        assertThat(created.getUpdatedAt()).isNull();
        assertThat(repository.exists(created.getId())).isTrue();
    }

    @Test
    void testCreateHotel_InvalidPrice_StoresNothing() {
        assertThatThrownBy(() -> managementService.createHotel(
                hotelRequest("Esplanade", "0", ZAGREB_LAT, ZAGREB_LNG)))
                .isInstanceOf(OutOfRangeException.class);
        assertThat(repository.count()).isZero();
    }

    @Test
    void testCreateHotel_MissingLatitude_ThrowsInvalidArgument() {
        HotelRequestDto request = new HotelRequestDto("Esplanade", new BigDecimal("100"), null, ZAGREB_LNG);

        assertThatThrownBy(() -> managementService.createHotel(request))
                .isInstanceOf(InvalidArgumentException.class)
                .extracting("argument").isEqualTo("latitude");
    }

    @Test
    void testGetHotel_Unknown_ReturnsEmpty() {
        assertThat(managementService.getHotel(UUID.randomUUID())).isEmpty();
    }

    @Test
    void testGetAllHotels_ReturnsEveryHotel() {
        managementService.createHotel(hotelRequest("One", "100", ZAGREB_LAT, ZAGREB_LNG));
        managementService.createHotel(hotelRequest("Two", "120", VIENNA_LAT, VIENNA_LNG));

        assertThat(managementService.getAllHotels())
                .extracting(HotelResponseDto::getName)
                .containsExactlyInAnyOrder("One", "Two");
    }

    @Test
    void testUpdateHotel_Existing_ReplacesFieldsAndStampsUpdate() {
        HotelResponseDto created = managementService.createHotel(hotelRequest("Old", "100", ZAGREB_LAT, ZAGREB_LNG));

        HotelResponseDto updated = managementService.updateHotel(
                created.getId(), hotelRequest("New", "140", VIENNA_LAT, VIENNA_LNG));

        assertThat(updated.getId()).isEqualTo(created.getId());
        assertThat(updated.getName()).isEqualTo("New");
        assertThat(updated.getLatitude()).isEqualTo(VIENNA_LAT);
        assertThat(updated.getCreatedAt()).isEqualTo(Common.NOW);
        assertThat(updated.getUpdatedAt()).isEqualTo(Common.NOW);
        assertThat(managementService.getHotel(created.getId()))
                .hasValueSatisfying(stored -> assertThat(stored.getName()).isEqualTo("New"));
    }

    @Test
    void testUpdateHotel_InvalidInput_LeavesStoredHotelUntouched() {
        HotelResponseDto created = managementService.createHotel(hotelRequest("Old", "100", ZAGREB_LAT, ZAGREB_LNG));

        assertThatThrownBy(() -> managementService.updateHotel(
                created.getId(), hotelRequest("New", "100", 95, 0)))
                .isInstanceOf(OutOfRangeException.class);

        assertThat(managementService.getHotel(created.getId()))
                .hasValueSatisfying(stored -> assertThat(stored.getName()).isEqualTo("Old"));
    }

    @Test
    void testUpdateHotel_Unknown_ThrowsNotFound() {
        UUID id = UUID.randomUUID();

        assertThatThrownBy(() -> managementService.updateHotel(id, hotelRequest("New", "100", 0, 0)))
                .isInstanceOf(HotelNotFoundException.class);
    }

    @Test
    void testDeleteHotel_SecondDelete_ThrowsNotFound() {
        HotelResponseDto created = managementService.createHotel(hotelRequest("Gone", "100", 0, 0));

        managementService.deleteHotel(created.getId());

        assertThat(repository.exists(created.getId())).isFalse();
        assertThatThrownBy(() -> managementService.deleteHotel(created.getId()))
                .isInstanceOf(HotelNotFoundException.class);
    }

    @Test
    void testMutations_ClearSearchCache() {
        searchCache.put("search:key", "stale");
        HotelResponseDto created = managementService.createHotel(hotelRequest("One", "100", 0, 0));
        assertThat(searchCache.get("search:key")).isNull();

        searchCache.put("search:key", "stale");
        managementService.updateHotel(created.getId(), hotelRequest("One", "110", 0, 0));
        assertThat(searchCache.get("search:key")).isNull();

        searchCache.put("search:key", "stale");
        managementService.deleteHotel(created.getId());
        assertThat(searchCache.get("search:key")).isNull();
    }

    @Test
    void testMutations_AdvanceCacheGeneration() {
        long initial = cacheGeneration.current();

        HotelResponseDto created = managementService.createHotel(hotelRequest("One", "100", 0, 0));
        managementService.updateHotel(created.getId(), hotelRequest("One", "110", 0, 0));
        managementService.deleteHotel(created.getId());

        assertThat(cacheGeneration.current()).isEqualTo(initial + 3);
    }

    @Test
    void testFailedMutation_KeepsSearchCache() {
        searchCache.put("search:key", "fresh");
        long initial = cacheGeneration.current();

        assertThatThrownBy(() -> managementService.deleteHotel(UUID.randomUUID()))
                .isInstanceOf(HotelNotFoundException.class);

        assertThat(searchCache.get("search:key")).isNotNull();
        assertThat(cacheGeneration.current()).isEqualTo(initial);
    }
}
