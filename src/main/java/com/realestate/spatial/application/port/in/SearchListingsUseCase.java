package com.realestate.spatial.application.port.in;

import com.realestate.spatial.api.dto.MapPointDto;
import com.realestate.spatial.api.dto.SpatialSearchRequestDto;
import com.realestate.spatial.api.dto.SpatialSearchResponseDto;
import com.realestate.spatial.domain.model.ListingFilters;

import java.util.List;

/**
 * Input port for spatial listing queries.
 */
public interface SearchListingsUseCase {

  SpatialSearchResponseDto search(SpatialSearchRequestDto request);

  /**
   * All active listings with a point, capped for map rendering.
   */
  List<MapPointDto> mapPoints(ListingFilters filters);
}
