package com.proximity.hotels.api.controller;

import com.proximity.hotels.api.dto.HotelRequestDto;
import com.proximity.hotels.api.dto.HotelResponseDto;
import com.proximity.hotels.application.port.in.ManageHotelsUseCase;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.UUID;

/**
 * Controller for hotel management.
 * Mutations require the admin bearer token (see AdminTokenFilter); reads are public.
 */
@RestController
@RequestMapping("/api/v1/hotels")
public class HotelController {

    private static final Logger logger = LoggerFactory.getLogger(HotelController.class);

    private final ManageHotelsUseCase manageHotelsUseCase;

    public HotelController(ManageHotelsUseCase manageHotelsUseCase) {
        this.manageHotelsUseCase = manageHotelsUseCase;
    }

    /**
     * POST /api/v1/hotels
     *
     * @param request Hotel fields
     * @return 201 with the created hotel and its location
     */
    @PostMapping
    public ResponseEntity<HotelResponseDto> createHotel(@Valid @RequestBody HotelRequestDto request) {
        logger.info("Creating hotel: name={}, lat={}, lng={}", request.getName(), request.getLatitude(), request.getLongitude());

        HotelResponseDto created = manageHotelsUseCase.createHotel(request);
        URI location = ServletUriComponentsBuilder.fromCurrentRequest()
                .path("/{id}")
                .buildAndExpand(created.getId())
                .toUri();
        return ResponseEntity.created(location).body(created);
    }

    /**
     * GET /api/v1/hotels/{id}
     *
     * @return 200 with the hotel, 404 if it does not exist
     */
    @GetMapping("/{id}")
    public ResponseEntity<HotelResponseDto> getHotel(@PathVariable UUID id) {
        logger.info("Retrieving hotel: {}", id);
        return manageHotelsUseCase.getHotel(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    public ResponseEntity<List<HotelResponseDto>> getAllHotels() {
        return ResponseEntity.ok(manageHotelsUseCase.getAllHotels());
    }

    /**
     * PUT /api/v1/hotels/{id}
     *
     * @return 200 with the updated hotel, 404 if it does not exist
     */
    @PutMapping("/{id}")
    public ResponseEntity<HotelResponseDto> updateHotel(@PathVariable UUID id,
            @Valid @RequestBody HotelRequestDto request) {
        logger.info("Updating hotel: {}", id);
        return ResponseEntity.ok(manageHotelsUseCase.updateHotel(id, request));
    }

    /**
     * DELETE /api/v1/hotels/{id}
     *
     * @return 204 once removed, 404 if it does not exist
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteHotel(@PathVariable UUID id) {
        logger.info("Deleting hotel: {}", id);
        manageHotelsUseCase.deleteHotel(id);
        return ResponseEntity.noContent().build();
    }
}
