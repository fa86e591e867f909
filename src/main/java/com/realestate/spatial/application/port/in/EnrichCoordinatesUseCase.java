package com.realestate.spatial.application.port.in;

import com.realestate.spatial.api.dto.GeocodeStatsDto;
import com.realestate.spatial.api.dto.ListingCoordinateDto;
import com.realestate.spatial.domain.model.Coordinate;
import com.realestate.spatial.domain.model.EnrichmentReport;

import java.util.UUID;

/**
 * Input port for filling in missing listing coordinates.
 */
public interface EnrichCoordinatesUseCase {

  /**
   * Geocode up to {@code batchSize} listings that still lack a coordinate.
   * Individual misses are counted, never thrown.
   */
  EnrichmentReport enrichBatch(int batchSize);

  GeocodeStatsDto geocodeStats();

  /**
   * Set a listing's coordinate by hand.
   */
  ListingCoordinateDto overrideCoordinate(UUID listingId, Coordinate coordinate);

  /**
   * Geocode one listing again, replacing any existing coordinate.
   */
  ListingCoordinateDto regeocode(UUID listingId);
}
