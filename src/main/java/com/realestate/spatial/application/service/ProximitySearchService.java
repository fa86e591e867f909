package com.realestate.spatial.application.service;

import com.realestate.spatial.api.dto.MapPointDto;
import com.realestate.spatial.api.dto.SpatialSearchRequestDto;
import com.realestate.spatial.api.dto.SpatialSearchResponseDto;
import com.realestate.spatial.application.mapper.ListingPointMapper;
import com.realestate.spatial.application.port.in.SearchListingsUseCase;
import com.realestate.spatial.application.port.out.ListingPointStore;
import com.realestate.spatial.domain.exception.SpatialValidationException;
import com.realestate.spatial.domain.model.ListingFilters;
import com.realestate.spatial.domain.model.ListingPoint;
import com.realestate.spatial.domain.model.SpatialPredicate;
import com.realestate.spatial.domain.service.GeometryTextCodec;
import com.realestate.spatial.infrastructure.config.SpatialProperties;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Polygon and bounding-box search over listings with a known point.
 */
@Service
public class ProximitySearchService implements SearchListingsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(ProximitySearchService.class);

    private final ListingPointStore listingPointStore;
    private final GeometryTextCodec geometryTextCodec;
    private final ListingPointMapper listingPointMapper;
    private final SpatialProperties.Search settings;

    public ProximitySearchService(
            ListingPointStore listingPointStore,
            GeometryTextCodec geometryTextCodec,
            ListingPointMapper listingPointMapper,
            SpatialProperties properties) {
        this.listingPointStore = listingPointStore;
        this.geometryTextCodec = geometryTextCodec;
        this.listingPointMapper = listingPointMapper;
        this.settings = properties.getSearch();
    }

    @Override
    @Transactional(readOnly = true)
    public SpatialSearchResponseDto search(SpatialSearchRequestDto request) {
        SpatialPredicate predicate = toPredicate(request);
        ListingFilters filters = new ListingFilters(request.getPropertyType(), request.getOfferType(),
                request.getPriceMin(), request.getPriceMax());

        int page = request.getPage() != null ? request.getPage() : 1;
        int pageSize = request.getPageSize() != null ? request.getPageSize() : settings.getDefaultPageSize();
        if (page < 1) {
            throw new SpatialValidationException("page must be >= 1");
        }
        if (pageSize < 1 || pageSize > settings.getMaxPageSize()) {
            throw new SpatialValidationException("pageSize must be between 1 and " + settings.getMaxPageSize());
        }
        long offset = (long) (page - 1) * pageSize;

        List<ListingPoint> points = listingPointStore.search(predicate, filters, pageSize, offset);
        logger.info("Spatial search ({}) page {} returned {} listings",
                predicate.getClass().getSimpleName(), page, points.size());

        return new SpatialSearchResponseDto(page, pageSize, points.size(), listingPointMapper.toDtos(points));
    }

    @Override
    @Transactional(readOnly = true)
    public List<MapPointDto> mapPoints(ListingFilters filters) {
        List<ListingPoint> points = listingPointStore.findAll(
                filters != null ? filters : ListingFilters.none(), settings.getMapPointsLimit());
        logger.debug("Map points query returned {} listings", points.size());
        return listingPointMapper.toDtos(points);
    }

    /**
     * Exactly one of polygon or bounding box must be present.
     */
    SpatialPredicate toPredicate(SpatialSearchRequestDto request) {
        boolean hasPolygon = request.getPolygonWkt() != null && !request.getPolygonWkt().isBlank();
        boolean hasBox = request.hasAnyBoundingBoxField();

        if (hasPolygon && hasBox) {
            throw new SpatialValidationException("Provide either polygonWkt or a bounding box, not both");
        }
        if (!hasPolygon && !hasBox) {
            throw new SpatialValidationException("Provide polygonWkt or a bounding box (minLat, minLon, maxLat, maxLon)");
        }

        if (hasPolygon) {
            Geometry area = geometryTextCodec.parseArea(request.getPolygonWkt());
            return new SpatialPredicate.PolygonIntersects(geometryTextCodec.toWkt(area));
        }

        if (!request.hasCompleteBoundingBox()) {
            throw new SpatialValidationException("Bounding box requires minLat, minLon, maxLat and maxLon");
        }
        double minLat = request.getMinLat();
        double minLon = request.getMinLon();
        double maxLat = request.getMaxLat();
        double maxLon = request.getMaxLon();
        if (minLat < -90 || maxLat > 90 || minLon < -180 || maxLon > 180) {
            throw new SpatialValidationException("Bounding box is outside valid latitude/longitude ranges");
        }
        if (minLat > maxLat || minLon > maxLon) {
            throw new SpatialValidationException("Bounding box minimum must not exceed maximum");
        }
        return new SpatialPredicate.BoundingBox(minLat, minLon, maxLat, maxLon);
    }
}
