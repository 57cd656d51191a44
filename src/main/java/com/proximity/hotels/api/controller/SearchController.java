package com.proximity.hotels.api.controller;

import com.proximity.hotels.api.dto.HotelSearchResultDto;
import com.proximity.hotels.api.dto.PagedResultDto;
import com.proximity.hotels.api.dto.SearchQueryDto;
import com.proximity.hotels.application.port.in.SearchHotelsUseCase;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for the proximity search endpoint.
 */
@RestController
@RequestMapping("/api/v1/search")
public class SearchController {

    private static final Logger logger = LoggerFactory.getLogger(SearchController.class);

    private final SearchHotelsUseCase searchHotelsUseCase;

    public SearchController(SearchHotelsUseCase searchHotelsUseCase) {
        this.searchHotelsUseCase = searchHotelsUseCase;
    }

    /**
     * GET /api/v1/search?latitude=X&longitude=Y&page=1&pageSize=10
     *
     * Every hotel ranked by price and distance from the query point, cheapest and
     * closest first.
     *
     * @param query Validated coordinates and paging
     * @return One page of ranked hotels with total counts
     */
    @GetMapping
    public ResponseEntity<PagedResultDto<HotelSearchResultDto>> search(@Valid @ModelAttribute SearchQueryDto query) {
        logger.info("Searching hotels: lat={}, lng={}, page={}, pageSize={}",
                query.getLatitude(), query.getLongitude(), query.getPage(), query.getPageSize());

        PagedResultDto<HotelSearchResultDto> result = searchHotelsUseCase.searchHotels(
                query.getLatitude(),
                query.getLongitude(),
                query.getPage(),
                query.getPageSize());
        return ResponseEntity.ok(result);
    }
}
