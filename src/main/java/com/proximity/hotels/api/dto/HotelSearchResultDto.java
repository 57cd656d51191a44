package com.proximity.hotels.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class HotelSearchResultDto {

    @JsonProperty("id")
    private UUID id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("pricePerNight")
    private BigDecimal pricePerNight;

    /**
     * Distance from the query point, rounded to two decimals.
     */
    @JsonProperty("distanceKm")
    private double distanceKm;
}
