package com.proximity.hotels.domain.model;

import lombok.Getter;
import lombok.ToString;

/**
 * A hotel paired with its exact distance from the query point. Built fresh for every search.
 */
@Getter
@ToString
public class HotelSearchResult {

    private final Hotel hotel;
    private final double distanceKm;

    public HotelSearchResult(Hotel hotel, double distanceKm) {
        if (hotel == null) {
            throw new IllegalArgumentException("Hotel must not be null");
        }
        this.hotel = hotel;
        this.distanceKm = distanceKm;
    }
}
