package com.realestate.spatial.infrastructure.persistence;

import com.realestate.spatial.application.port.out.ListingRepository;
import com.realestate.spatial.domain.model.GeocodeSource;
import com.realestate.spatial.domain.model.Listing;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * JPA implementation of ListingRepository output port.
 */
@Repository
public interface ListingJpaRepository extends JpaRepository<Listing, UUID>, ListingRepository {

    @Query("SELECT l.id AS id, l.locationText AS locationText FROM Listing l " +
            "WHERE l.active = true AND l.latitude IS NULL " +
            "AND l.locationText IS NOT NULL AND TRIM(l.locationText) <> '' " +
            "ORDER BY l.geocodeAttemptedAt ASC NULLS FIRST, l.firstSeenAt ASC, l.id ASC")
    List<PendingGeocode> findPendingGeocodingPage(Pageable pageable);

    @Override
    default List<PendingGeocode> findPendingGeocoding(int limit) {
        return findPendingGeocodingPage(PageRequest.of(0, limit));
    }

    /**
     * Guarded by {@code latitude IS NULL} so a concurrent writer that got
     * there first is never overwritten.
     */
    @Override
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Listing l SET l.latitude = :latitude, l.longitude = :longitude, " +
            "l.geocodeSource = :source, l.geocodedAt = :geocodedAt " +
            "WHERE l.id = :id AND l.latitude IS NULL")
    int updateCoordinateIfMissing(
        @Param("id") UUID id,
        @Param("latitude") double latitude,
        @Param("longitude") double longitude,
        @Param("source") GeocodeSource source,
        @Param("geocodedAt") OffsetDateTime geocodedAt
    );

    @Override
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Listing l SET l.geocodeAttemptedAt = :attemptedAt WHERE l.id = :id AND l.latitude IS NULL")
    int markGeocodeAttempt(@Param("id") UUID id, @Param("attemptedAt") OffsetDateTime attemptedAt);

    @Override
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Listing l SET l.latitude = :latitude, l.longitude = :longitude, " +
            "l.geocodeSource = :source, l.geocodedAt = :geocodedAt " +
            "WHERE l.id = :id AND (l.latitude IS NULL OR l.longitude IS NULL " +
            "OR l.latitude <> :latitude OR l.longitude <> :longitude OR l.geocodeSource <> :source)")
    int replaceCoordinate(
        @Param("id") UUID id,
        @Param("latitude") double latitude,
        @Param("longitude") double longitude,
        @Param("source") GeocodeSource source,
        @Param("geocodedAt") OffsetDateTime geocodedAt
    );

    @Override
    @Query("SELECT COUNT(l) FROM Listing l WHERE l.latitude IS NOT NULL AND l.longitude IS NOT NULL")
    long countWithCoordinate();

    @Override
    @Query("SELECT COUNT(l) FROM Listing l WHERE l.active = true AND l.latitude IS NULL")
    long countActiveWithoutCoordinate();

    @Override
    @Query("SELECT l.geocodeSource AS source, COUNT(l) AS total FROM Listing l GROUP BY l.geocodeSource")
    List<SourceCount> countBySource();
}
