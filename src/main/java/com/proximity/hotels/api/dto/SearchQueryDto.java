package com.proximity.hotels.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Query parameters of the search endpoint, bound with {@code @ModelAttribute}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class SearchQueryDto {

    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be between -90 and 90")
    @DecimalMax(value = "90.0", message = "Latitude must be between -90 and 90")
    private Double latitude;

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be between -180 and 180")
    @DecimalMax(value = "180.0", message = "Longitude must be between -180 and 180")
    private Double longitude;

    @NotNull(message = "Page is required")
    @Min(value = 1, message = "Page must be greater than 0")
    private Integer page = 1;

    @NotNull(message = "Page size is required")
    @Min(value = 1, message = "Page size must be between 1 and 100")
    @Max(value = 100, message = "Page size must be between 1 and 100")
    private Integer pageSize = 10;
}
