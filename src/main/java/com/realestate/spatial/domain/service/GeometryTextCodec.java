package com.realestate.spatial.domain.service;

import com.realestate.spatial.domain.exception.SpatialValidationException;
import com.realestate.spatial.domain.model.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.io.WKTWriter;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Converts between coordinate pairs and WKT geometry in EPSG:4326.
 *
 * Ordering rule: {@link Coordinate} is latitude first, geometry text is
 * longitude first ({@code POINT (lon lat)}). This class is the only place that
 * swaps the two.
 */
@Service
public class GeometryTextCodec {

    public static final int WGS84_SRID = 4326;

    private final GeometryFactory geometryFactory = new GeometryFactory(new PrecisionModel(), WGS84_SRID);

    public GeometryFactory getGeometryFactory() {
        return geometryFactory;
    }

    public Point point(Coordinate coordinate) {
        return geometryFactory.createPoint(toJts(coordinate));
    }

    public LineString lineString(List<Coordinate> coordinates) {
        if (coordinates.size() < 2) {
            throw new SpatialValidationException("A line needs at least two points");
        }
        org.locationtech.jts.geom.Coordinate[] points = coordinates.stream()
                .map(GeometryTextCodec::toJts)
                .toArray(org.locationtech.jts.geom.Coordinate[]::new);
        return geometryFactory.createLineString(points);
    }

    public LineString straightLine(Coordinate start, Coordinate end) {
        return lineString(List.of(start, end));
    }

    public String toWkt(Geometry geometry) {
        return new WKTWriter().write(geometry);
    }

    /**
     * Parse any WKT geometry and tag it with SRID 4326.
     *
     * @throws SpatialValidationException if the text is blank or not valid WKT
     */
    public Geometry parse(String wkt) {
        if (wkt == null || wkt.isBlank()) {
            throw new SpatialValidationException("Geometry text must not be empty");
        }
        try {
            // WKTReader is not thread-safe
            Geometry geometry = new WKTReader(geometryFactory).read(wkt);
            geometry.setSRID(WGS84_SRID);
            return geometry;
        } catch (ParseException e) {
            throw new SpatialValidationException("Invalid geometry text: " + e.getMessage(), e);
        }
    }

    /**
     * Parse WKT that must describe an area (POLYGON or MULTIPOLYGON).
     */
    public Geometry parseArea(String wkt) {
        Geometry geometry = parse(wkt);
        if (!(geometry instanceof Polygon) && !(geometry instanceof MultiPolygon)) {
            throw new SpatialValidationException(
                    "Expected POLYGON or MULTIPOLYGON but got " + geometry.getGeometryType().toUpperCase());
        }
        if (geometry.isEmpty()) {
            throw new SpatialValidationException("Polygon must not be empty");
        }
        return geometry;
    }

    public static org.locationtech.jts.geom.Coordinate toJts(Coordinate coordinate) {
        return new org.locationtech.jts.geom.Coordinate(coordinate.getLongitude(), coordinate.getLatitude());
    }

    public static Coordinate fromJts(org.locationtech.jts.geom.Coordinate coordinate) {
        return new Coordinate(coordinate.getY(), coordinate.getX());
    }
}
