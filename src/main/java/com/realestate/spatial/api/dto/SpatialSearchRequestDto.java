package com.realestate.spatial.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Search body: either {@code polygonWkt} or all four bounding box fields.
 */
@Getter
@Setter
@NoArgsConstructor
public class SpatialSearchRequestDto {

    @JsonProperty("polygonWkt")
    private String polygonWkt;

    @JsonProperty("minLat")
    private Double minLat;

    @JsonProperty("minLon")
    private Double minLon;

    @JsonProperty("maxLat")
    private Double maxLat;

    @JsonProperty("maxLon")
    private Double maxLon;

    @JsonProperty("propertyType")
    private String propertyType;

    @JsonProperty("offerType")
    private String offerType;

    @JsonProperty("priceMin")
    private BigDecimal priceMin;

    @JsonProperty("priceMax")
    private BigDecimal priceMax;

    @Min(value = 1, message = "page must be >= 1")
    @JsonProperty("page")
    private Integer page = 1;

    @Min(value = 1, message = "pageSize must be >= 1")
    @Max(value = 500, message = "pageSize must be <= 500")
    @JsonProperty("pageSize")
    private Integer pageSize;

    public boolean hasAnyBoundingBoxField() {
        return minLat != null || minLon != null || maxLat != null || maxLon != null;
    }

    public boolean hasCompleteBoundingBox() {
        return minLat != null && minLon != null && maxLat != null && maxLon != null;
    }
}
