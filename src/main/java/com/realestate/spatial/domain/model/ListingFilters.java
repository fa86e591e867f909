package com.realestate.spatial.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Optional attribute filters, AND-combined with the spatial predicate.
 * A null field means "no constraint".
 */
@Getter
@EqualsAndHashCode
@ToString
public class ListingFilters {

    private static final ListingFilters NONE = new ListingFilters(null, null, null, null);

    private final String propertyType;
    private final String offerType;
    private final BigDecimal priceMin;
    private final BigDecimal priceMax;

    public ListingFilters(String propertyType, String offerType, BigDecimal priceMin, BigDecimal priceMax) {
        this.propertyType = blankToNull(propertyType);
        this.offerType = blankToNull(offerType);
        this.priceMin = priceMin;
        this.priceMax = priceMax;
    }

    public static ListingFilters none() {
        return NONE;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
