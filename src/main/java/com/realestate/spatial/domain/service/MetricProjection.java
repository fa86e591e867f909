package com.realestate.spatial.domain.service;

import com.realestate.spatial.infrastructure.config.SpatialProperties;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.ProjCoordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reprojects JTS geometries between WGS84 and the configured metric CRS
 * (UTM zone 33N by default, which covers the Czech Republic).
 */
@Service
public class MetricProjection {

    private static final Logger logger = LoggerFactory.getLogger(MetricProjection.class);
    private static final String WGS84_DEFINITION = "+proj=longlat +datum=WGS84 +no_defs";

    private final CoordinateReferenceSystem wgs84;
    private final CoordinateReferenceSystem metric;
    private final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();

    public MetricProjection(SpatialProperties properties) {
        CRSFactory crsFactory = new CRSFactory();
        this.wgs84 = crsFactory.createFromParameters("WGS84", WGS84_DEFINITION);
        this.metric = crsFactory.createFromParameters("METRIC", properties.getCorridor().getMetricCrs());
        logger.info("Metric projection initialised: {}", properties.getCorridor().getMetricCrs());
    }

    public Geometry toMetric(Geometry geographic) {
        Geometry projected = reproject(geographic, transformFactory.createTransform(wgs84, metric));
        projected.setSRID(0);
        return projected;
    }

    public Geometry toGeographic(Geometry projected) {
        Geometry geographic = reproject(projected, transformFactory.createTransform(metric, wgs84));
        geographic.setSRID(GeometryTextCodec.WGS84_SRID);
        return geographic;
    }

    // CoordinateTransform keeps scratch state, so each call gets its own instance
    private Geometry reproject(Geometry source, CoordinateTransform transform) {
        Geometry copy = source.copy();
        copy.apply(new CoordinateSequenceFilter() {
            private final ProjCoordinate in = new ProjCoordinate();
            private final ProjCoordinate out = new ProjCoordinate();

            @Override
            public void filter(CoordinateSequence sequence, int i) {
                in.x = sequence.getX(i);
                in.y = sequence.getY(i);
                transform.transform(in, out);
                sequence.setOrdinate(i, CoordinateSequence.X, out.x);
                sequence.setOrdinate(i, CoordinateSequence.Y, out.y);
            }

            @Override
            public boolean isDone() {
                return false;
            }

            @Override
            public boolean isGeometryChanged() {
                return true;
            }
        });
        copy.geometryChanged();
        return copy;
    }
}
