package com.realestate.spatial.application.service;

import com.realestate.spatial.api.dto.CoordinateDto;
import com.realestate.spatial.api.dto.CorridorResponseDto;
import com.realestate.spatial.application.dto.CorridorCommand;
import com.realestate.spatial.application.mapper.ListingPointMapper;
import com.realestate.spatial.application.port.in.BuildCorridorUseCase;
import com.realestate.spatial.application.port.in.GeocodeLocationUseCase;
import com.realestate.spatial.application.port.in.ManageSavedAreasUseCase;
import com.realestate.spatial.application.port.out.ListingPointStore;
import com.realestate.spatial.application.port.out.RoutingPort;
import com.realestate.spatial.domain.exception.LocationNotResolvedException;
import com.realestate.spatial.domain.exception.SpatialValidationException;
import com.realestate.spatial.domain.model.AreaMetadata;
import com.realestate.spatial.domain.model.AreaType;
import com.realestate.spatial.domain.model.Coordinate;
import com.realestate.spatial.domain.model.GeocodeOutcome;
import com.realestate.spatial.domain.model.IntersectingListings;
import com.realestate.spatial.domain.model.TrackParseResult;
import com.realestate.spatial.domain.service.CorridorGeometryBuilder;
import com.realestate.spatial.domain.service.GeometryTextCodec;
import com.realestate.spatial.domain.service.GpxTrackParser;
import com.realestate.spatial.infrastructure.config.SpatialProperties;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * Builds search corridors around a route or an uploaded track and counts the
 * listings inside them.
 *
 * Flow: geocode endpoints -> route (straight line if the router fails) ->
 * buffer in metric CRS -> single spatial count -> optional save.
 * No transaction spans the network calls.
 */
@Service
public class CorridorService implements BuildCorridorUseCase {

    private static final Logger logger = LoggerFactory.getLogger(CorridorService.class);

    private final GeocodeLocationUseCase geocodeLocationUseCase;
    private final RoutingPort routingPort;
    private final CorridorGeometryBuilder corridorGeometryBuilder;
    private final GeometryTextCodec geometryTextCodec;
    private final GpxTrackParser gpxTrackParser;
    private final ListingPointStore listingPointStore;
    private final ManageSavedAreasUseCase manageSavedAreasUseCase;
    private final ListingPointMapper listingPointMapper;
    private final SpatialProperties properties;

    public CorridorService(
            GeocodeLocationUseCase geocodeLocationUseCase,
            RoutingPort routingPort,
            CorridorGeometryBuilder corridorGeometryBuilder,
            GeometryTextCodec geometryTextCodec,
            GpxTrackParser gpxTrackParser,
            ListingPointStore listingPointStore,
            ManageSavedAreasUseCase manageSavedAreasUseCase,
            ListingPointMapper listingPointMapper,
            SpatialProperties properties) {
        this.geocodeLocationUseCase = geocodeLocationUseCase;
        this.routingPort = routingPort;
        this.corridorGeometryBuilder = corridorGeometryBuilder;
        this.geometryTextCodec = geometryTextCodec;
        this.gpxTrackParser = gpxTrackParser;
        this.listingPointStore = listingPointStore;
        this.manageSavedAreasUseCase = manageSavedAreasUseCase;
        this.listingPointMapper = listingPointMapper;
        this.properties = properties;
    }

    @Override
    public CorridorResponseDto buildCorridor(CorridorCommand command) {
        validateBuffer(command.getBufferMeters());
        logger.info("Building corridor '{}' -> '{}' with buffer {} m", command.getStart(), command.getEnd(),
                command.getBufferMeters());

        Coordinate start = resolveEndpoint("start", command.getStart());
        Coordinate end = resolveEndpoint("end", command.getEnd());

        LineString line = null;
        boolean routed = false;
        if (command.isUseRoute()) {
            ensureNotCancelled();
            Optional<LineString> route = routingPort.route(start, end);
            if (route.isPresent()) {
                line = route.get();
                routed = true;
            } else {
                logger.info("No route between {} and {}, using straight line", start, end);
            }
        }
        if (line == null) {
            line = geometryTextCodec.straightLine(start, end);
        }

        Geometry corridor = buildCorridorFromLine(line, command.getBufferMeters());
        String corridorWkt = geometryTextCodec.toWkt(corridor);

        CorridorResponseDto response = new CorridorResponseDto();
        response.setPolygonWkt(corridorWkt);
        response.setStart(toDto(start));
        response.setEnd(toDto(end));
        response.setBufferMeters(command.getBufferMeters());
        response.setRouted(routed);
        applyMatches(response, corridorWkt, command.isIncludeListings());

        if (hasText(command.getSaveAsName())) {
            AreaMetadata metadata = new AreaMetadata(command.getDescription(), command.getStart().trim(),
                    command.getEnd().trim(), command.getBufferMeters());
            UUID areaId = manageSavedAreasUseCase.saveArea(command.getSaveAsName(), corridor, AreaType.CORRIDOR,
                    metadata);
            response.setSavedAreaId(areaId);
        }

        logger.info("Corridor built: routed={}, matches={}", routed, response.getMatchCount());
        return response;
    }

    @Override
    public CorridorResponseDto buildCorridorFromTrack(byte[] trackContent, int bufferMeters, String saveAsName) {
        validateBuffer(bufferMeters);
        TrackParseResult track = gpxTrackParser.parse(trackContent);
        logger.info("Building corridor from track with {} points, buffer {} m", track.getPointCount(), bufferMeters);

        Geometry corridor = buildCorridorFromLine(track.getLine(), bufferMeters);
        String corridorWkt = geometryTextCodec.toWkt(corridor);

        CorridorResponseDto response = new CorridorResponseDto();
        response.setPolygonWkt(corridorWkt);
        response.setStart(toDto(track.getStart()));
        response.setEnd(toDto(track.getEnd()));
        response.setBufferMeters(bufferMeters);
        response.setRouted(false);
        response.setPointCount(track.getPointCount());
        applyMatches(response, corridorWkt, false);

        if (hasText(saveAsName)) {
            AreaMetadata metadata = new AreaMetadata(null, track.getStart().toString(),
                    track.getEnd().toString(), bufferMeters);
            response.setSavedAreaId(manageSavedAreasUseCase.saveArea(saveAsName, corridor, AreaType.TRACK_CORRIDOR,
                    metadata));
        }
        return response;
    }

    @Override
    public Geometry buildCorridorFromLine(LineString line, int bufferMeters) {
        validateBuffer(bufferMeters);
        if (line == null || line.getNumPoints() < 2) {
            throw new SpatialValidationException("Corridor line needs at least two points");
        }
        return corridorGeometryBuilder.buffer(line, bufferMeters);
    }

    private void applyMatches(CorridorResponseDto response, String corridorWkt, boolean includeListings) {
        if (includeListings) {
            IntersectingListings matches = listingPointStore.findIntersecting(corridorWkt,
                    properties.getSearch().getMapPointsLimit());
            response.setListings(listingPointMapper.toDtos(matches.getPoints()));
            response.setMatchCount(matches.getTotalMatches());
        } else {
            response.setMatchCount(listingPointStore.countIntersecting(corridorWkt));
        }
    }

    private Coordinate resolveEndpoint(String role, String text) {
        ensureNotCancelled();
        GeocodeOutcome outcome = geocodeLocationUseCase.resolve(text);
        if (!outcome.isFound()) {
            throw new LocationNotResolvedException(role, text);
        }
        return outcome.getCoordinate();
    }

    private void validateBuffer(int bufferMeters) {
        SpatialProperties.Corridor limits = properties.getCorridor();
        if (bufferMeters < limits.getMinBufferMeters() || bufferMeters > limits.getMaxBufferMeters()) {
            throw new SpatialValidationException(String.format("bufferMeters must be between %d and %d, got %d",
                    limits.getMinBufferMeters(), limits.getMaxBufferMeters(), bufferMeters));
        }
    }

    private static void ensureNotCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Corridor request cancelled");
        }
    }

    private static CoordinateDto toDto(Coordinate coordinate) {
        return new CoordinateDto(coordinate.getLatitude(), coordinate.getLongitude());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
