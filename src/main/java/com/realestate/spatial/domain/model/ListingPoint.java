package com.realestate.spatial.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Map-ready projection of a listing with a known coordinate.
 */
@Getter
@AllArgsConstructor
public class ListingPoint {

    private final UUID id;
    private final String title;
    private final BigDecimal price;
    private final String locationText;
    private final double latitude;
    private final double longitude;
    private final String propertyType;
    private final String offerType;
    private final String mainPhotoUrl;
    private final String sourceCode;
}
