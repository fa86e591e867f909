package com.realestate.spatial.application.port.in;

import com.realestate.spatial.api.dto.SavedAreaDto;
import com.realestate.spatial.domain.model.AreaMetadata;
import com.realestate.spatial.domain.model.AreaType;
import org.locationtech.jts.geom.Geometry;

import java.util.List;
import java.util.UUID;

/**
 * Input port for named search areas.
 */
public interface ManageSavedAreasUseCase {

  /**
   * Insert a new area. Saving the same geometry twice creates two rows.
   *
   * @return id of the new area
   */
  UUID saveArea(String name, String geometryWkt, AreaType type, AreaMetadata metadata);

  UUID saveArea(String name, Geometry geometry, AreaType type, AreaMetadata metadata);

  List<SavedAreaDto> listAreas(boolean activeOnly);

  void deactivateArea(UUID id);
}
