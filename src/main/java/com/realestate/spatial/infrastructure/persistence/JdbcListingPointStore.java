package com.realestate.spatial.infrastructure.persistence;

import com.realestate.spatial.application.port.out.ListingPointStore;
import com.realestate.spatial.domain.model.IntersectingListings;
import com.realestate.spatial.domain.model.ListingFilters;
import com.realestate.spatial.domain.model.ListingPoint;
import com.realestate.spatial.domain.model.SpatialPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * PostGIS-backed spatial queries over the listings table.
 *
 * Every predicate variant maps to a fixed SQL fragment; filter values and
 * geometry text are always bound as parameters, never concatenated.
 */
@Repository
public class JdbcListingPointStore implements ListingPointStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcListingPointStore.class);

    private static final String POINT_COLUMNS =
            "l.id, l.title, l.price, l.location_text, l.latitude, l.longitude, " +
            "l.property_type, l.offer_type, l.main_photo_url, l.source_code ";

    private static final String SELECT_POINTS = "SELECT " + POINT_COLUMNS + "FROM listings l ";

    // the window count is evaluated before LIMIT
    private static final String SELECT_POINTS_WITH_TOTAL =
            "SELECT " + POINT_COLUMNS + ", COUNT(*) OVER () AS total_matches FROM listings l ";

    private static final String ACTIVE_WITH_POINT =
            "WHERE l.is_active = TRUE AND l.location_point IS NOT NULL ";

    private static final String POLYGON_PREDICATE =
            "AND ST_Intersects(l.location_point, ST_GeomFromText(:polygonWkt, 4326)) ";

    private static final String BBOX_PREDICATE =
            "AND l.location_point && ST_MakeEnvelope(:minLon, :minLat, :maxLon, :maxLat, 4326) ";

    private static final String STABLE_ORDER = "ORDER BY l.first_seen_at ASC, l.id ASC ";

    private static final RowMapper<ListingPoint> ROW_MAPPER = (rs, rowNum) -> new ListingPoint(
            rs.getObject("id", UUID.class),
            rs.getString("title"),
            rs.getBigDecimal("price"),
            rs.getString("location_text"),
            rs.getDouble("latitude"),
            rs.getDouble("longitude"),
            rs.getString("property_type"),
            rs.getString("offer_type"),
            rs.getString("main_photo_url"),
            rs.getString("source_code"));

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcListingPointStore(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public long countIntersecting(String polygonWkt) {
        String sql = "SELECT COUNT(*) FROM listings l " + ACTIVE_WITH_POINT + POLYGON_PREDICATE;
        Long count = jdbcTemplate.queryForObject(sql,
                new MapSqlParameterSource("polygonWkt", polygonWkt), Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public IntersectingListings findIntersecting(String polygonWkt, int limit) {
        String sql = SELECT_POINTS_WITH_TOTAL + ACTIVE_WITH_POINT + POLYGON_PREDICATE + STABLE_ORDER + "LIMIT :limit";
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("polygonWkt", polygonWkt)
                .addValue("limit", limit);

        ResultSetExtractor<IntersectingListings> extractor = rs -> {
            List<ListingPoint> points = new ArrayList<>();
            long totalMatches = 0L;
            while (rs.next()) {
                if (points.isEmpty()) {
                    totalMatches = rs.getLong("total_matches");
                }
                points.add(ROW_MAPPER.mapRow(rs, points.size()));
            }
            return new IntersectingListings(points, totalMatches);
        };
        return jdbcTemplate.query(sql, params, extractor);
    }

    @Override
    public List<ListingPoint> search(SpatialPredicate predicate, ListingFilters filters, int limit, long offset) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder sql = new StringBuilder(SELECT_POINTS).append(ACTIVE_WITH_POINT);

        if (predicate instanceof SpatialPredicate.PolygonIntersects) {
            SpatialPredicate.PolygonIntersects polygon = (SpatialPredicate.PolygonIntersects) predicate;
            sql.append(POLYGON_PREDICATE);
            params.addValue("polygonWkt", polygon.getPolygonWkt());
        } else if (predicate instanceof SpatialPredicate.BoundingBox) {
            SpatialPredicate.BoundingBox box = (SpatialPredicate.BoundingBox) predicate;
            sql.append(BBOX_PREDICATE);
            params.addValue("minLon", box.getMinLongitude())
                    .addValue("minLat", box.getMinLatitude())
                    .addValue("maxLon", box.getMaxLongitude())
                    .addValue("maxLat", box.getMaxLatitude());
        } else {
            throw new IllegalArgumentException("Unsupported spatial predicate: " + predicate);
        }

        appendFilters(sql, params, filters);
        sql.append(STABLE_ORDER).append("LIMIT :limit OFFSET :offset");
        params.addValue("limit", limit).addValue("offset", offset);

        logger.debug("Spatial search: predicate={}, filters={}, limit={}, offset={}", predicate, filters, limit, offset);
        return jdbcTemplate.query(sql.toString(), params, ROW_MAPPER);
    }

    @Override
    public List<ListingPoint> findAll(ListingFilters filters, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder sql = new StringBuilder(SELECT_POINTS).append(ACTIVE_WITH_POINT);
        appendFilters(sql, params, filters);
        sql.append(STABLE_ORDER).append("LIMIT :limit");
        params.addValue("limit", limit);
        return jdbcTemplate.query(sql.toString(), params, ROW_MAPPER);
    }

    private static void appendFilters(StringBuilder sql, MapSqlParameterSource params, ListingFilters filters) {
        if (filters == null) {
            return;
        }
        if (filters.getPropertyType() != null) {
            sql.append("AND l.property_type = :propertyType ");
            params.addValue("propertyType", filters.getPropertyType());
        }
        if (filters.getOfferType() != null) {
            sql.append("AND l.offer_type = :offerType ");
            params.addValue("offerType", filters.getOfferType());
        }
        if (filters.getPriceMin() != null) {
            sql.append("AND l.price >= :priceMin ");
            params.addValue("priceMin", filters.getPriceMin());
        }
        if (filters.getPriceMax() != null) {
            sql.append("AND l.price <= :priceMax ");
            params.addValue("priceMax", filters.getPriceMax());
        }
    }
}
