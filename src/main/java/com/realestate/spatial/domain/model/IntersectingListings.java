package com.realestate.spatial.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Listings inside an area, capped, with the uncapped match count.
 */
@Getter
@AllArgsConstructor
public class IntersectingListings {

    private final List<ListingPoint> points;
    private final long totalMatches;
}
