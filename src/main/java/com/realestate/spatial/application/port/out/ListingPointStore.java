package com.realestate.spatial.application.port.out;

import com.realestate.spatial.domain.model.IntersectingListings;
import com.realestate.spatial.domain.model.ListingFilters;
import com.realestate.spatial.domain.model.ListingPoint;
import com.realestate.spatial.domain.model.SpatialPredicate;

import java.util.List;

/**
 * Output port for spatial queries over active listings with a known point.
 * Results are ordered by first-seen time, then id.
 */
public interface ListingPointStore {

    long countIntersecting(String polygonWkt);

    /**
     * First {@code limit} listings inside the polygon, with the count of all of them.
     */
    IntersectingListings findIntersecting(String polygonWkt, int limit);

    List<ListingPoint> search(SpatialPredicate predicate, ListingFilters filters, int limit, long offset);

    List<ListingPoint> findAll(ListingFilters filters, int limit);
}
