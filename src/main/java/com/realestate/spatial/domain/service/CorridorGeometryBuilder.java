package com.realestate.spatial.domain.service;

import com.realestate.spatial.infrastructure.config.SpatialProperties;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.operation.buffer.BufferOp;
import org.locationtech.jts.operation.buffer.BufferParameters;
import org.springframework.stereotype.Service;

/**
 * Buffers a WGS84 polyline by a distance in metres.
 * The buffer is computed in the metric CRS so the distance is uniform along
 * the whole line, then the polygon is projected back to WGS84.
 */
@Service
public class CorridorGeometryBuilder {

    private final MetricProjection projection;
    private final int quadrantSegments;

    public CorridorGeometryBuilder(MetricProjection projection, SpatialProperties properties) {
        this.projection = projection;
        this.quadrantSegments = properties.getCorridor().getQuadrantSegments();
    }

    /**
     * @param line polyline in EPSG:4326 (x = longitude)
     * @param bufferMeters buffer distance, already validated by the caller
     * @return corridor polygon in EPSG:4326
     */
    public Geometry buffer(LineString line, int bufferMeters) {
        Geometry metricLine = projection.toMetric(line);

        BufferParameters parameters = new BufferParameters(quadrantSegments, BufferParameters.CAP_ROUND);
        Geometry metricCorridor = BufferOp.bufferOp(metricLine, bufferMeters, parameters);

        return projection.toGeographic(metricCorridor);
    }

    /**
     * Area of a WGS84 geometry in square metres, measured in the metric CRS.
     */
    public double areaSquareMeters(Geometry geographic) {
        return projection.toMetric(geographic).getArea();
    }
}
