package com.proximity.hotels.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Request body for creating or updating a hotel.
 * The domain re-validates every field; these annotations give field-level messages.
 * Name length is left to the domain, which measures the trimmed name.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class HotelRequestDto {

    @JsonProperty("name")
    @NotBlank(message = "Hotel name is required")
    private String name;

    @JsonProperty("pricePerNight")
    @NotNull(message = "Price per night is required")
    @DecimalMin(value = "0.01", message = "Price per night must be at least 0.01")
    @DecimalMax(value = "100000000", message = "Price per night cannot exceed 100000000")
    private BigDecimal pricePerNight;

    @JsonProperty("latitude")
    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be between -90 and 90")
    @DecimalMax(value = "90.0", message = "Latitude must be between -90 and 90")
    private Double latitude;

    @JsonProperty("longitude")
    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be between -180 and 180")
    @DecimalMax(value = "180.0", message = "Longitude must be between -180 and 180")
    private Double longitude;
}
