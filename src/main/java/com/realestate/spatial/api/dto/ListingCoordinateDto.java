package com.realestate.spatial.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

/**
 * Coordinate state of one listing after an override or re-geocode.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ListingCoordinateDto {

    @JsonProperty("listingId")
    private UUID listingId;

    @JsonProperty("latitude")
    private double latitude;

    @JsonProperty("longitude")
    private double longitude;

    @JsonProperty("geocodeSource")
    private String geocodeSource;

    @JsonProperty("changed")
    private boolean changed;
}
