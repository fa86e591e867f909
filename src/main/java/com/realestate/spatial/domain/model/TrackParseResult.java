package com.realestate.spatial.domain.model;

import lombok.Getter;
import org.locationtech.jts.geom.LineString;

/**
 * Polyline recovered from an uploaded track file.
 */
@Getter
public class TrackParseResult {

    private final LineString line;
    private final Coordinate start;
    private final Coordinate end;
    private final int pointCount;

    public TrackParseResult(LineString line, Coordinate start, Coordinate end, int pointCount) {
        this.line = line;
        this.start = start;
        this.end = end;
        this.pointCount = pointCount;
    }
}
