package com.realestate.spatial.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Spatial condition a listing point must satisfy.
 * Each variant is evaluated by its own query.
 */
public interface SpatialPredicate {

    /**
     * Point lies inside (or on the boundary of) a polygon given as WKT in EPSG:4326.
     */
    @Getter
    @EqualsAndHashCode
    @ToString
    final class PolygonIntersects implements SpatialPredicate {
        private final String polygonWkt;

        public PolygonIntersects(String polygonWkt) {
            this.polygonWkt = polygonWkt;
        }
    }

    /**
     * Point lies within an axis-aligned latitude/longitude box.
     */
    @Getter
    @EqualsAndHashCode
    @ToString
    final class BoundingBox implements SpatialPredicate {
        private final double minLatitude;
        private final double minLongitude;
        private final double maxLatitude;
        private final double maxLongitude;

        public BoundingBox(double minLatitude, double minLongitude, double maxLatitude, double maxLongitude) {
            this.minLatitude = minLatitude;
            this.minLongitude = minLongitude;
            this.maxLatitude = maxLatitude;
            this.maxLongitude = maxLongitude;
        }
    }
}
