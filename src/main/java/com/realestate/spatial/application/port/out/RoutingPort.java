package com.realestate.spatial.application.port.out;

import com.realestate.spatial.domain.model.Coordinate;
import org.locationtech.jts.geom.LineString;

import java.util.Optional;

/**
 * Output port for the external road router.
 */
public interface RoutingPort {

    /**
     * Road route between two points as a WGS84 polyline.
     *
     * @return empty when the router is unreachable, answers with an error or
     *         returns fewer than two points
     */
    Optional<LineString> route(Coordinate start, Coordinate end);
}
