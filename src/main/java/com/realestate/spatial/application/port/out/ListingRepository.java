package com.realestate.spatial.application.port.out;

import com.realestate.spatial.domain.model.GeocodeSource;
import com.realestate.spatial.domain.model.Listing;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Output port for reading listings and writing their geocode columns.
 */
public interface ListingRepository {

  Optional<Listing> findById(UUID id);

  /**
   * Active listings without a coordinate but with location text. Listings
   * never tried come first, then the least recently tried; ties by age.
   */
  List<PendingGeocode> findPendingGeocoding(int limit);

  /**
   * Set the coordinate only if the listing still has none.
   *
   * @return number of rows changed (0 or 1)
   */
  int updateCoordinateIfMissing(UUID id, double latitude, double longitude, GeocodeSource source,
      OffsetDateTime geocodedAt);

  /**
   * Remember a failed lookup so the listing moves to the back of the queue.
   */
  int markGeocodeAttempt(UUID id, OffsetDateTime attemptedAt);

  /**
   * Replace the coordinate unless it already holds the same value.
   *
   * @return number of rows changed (0 or 1)
   */
  int replaceCoordinate(UUID id, double latitude, double longitude, GeocodeSource source,
      OffsetDateTime geocodedAt);

  long count();

  long countWithCoordinate();

  long countActiveWithoutCoordinate();

  List<SourceCount> countBySource();

  Listing save(Listing listing);

  /**
   * Minimal view of a listing waiting for geocoding.
   */
  interface PendingGeocode {
    UUID getId();

    String getLocationText();
  }

  interface SourceCount {
    GeocodeSource getSource();

    long getTotal();
  }
}
