package com.realestate.spatial.application.mapper;

import com.realestate.spatial.api.dto.SavedAreaDto;
import com.realestate.spatial.domain.model.SavedArea;
import com.realestate.spatial.domain.service.GeometryTextCodec;
import org.springframework.stereotype.Component;

/**
 * Maps saved areas to their API form, geometry rendered as WKT.
 */
@Component
public class SavedAreaMapper {

  private final GeometryTextCodec geometryTextCodec;

  public SavedAreaMapper(GeometryTextCodec geometryTextCodec) {
    this.geometryTextCodec = geometryTextCodec;
  }

  public SavedAreaDto toDto(SavedArea area) {
    return new SavedAreaDto(
        area.getId(),
        area.getName(),
        area.getDescription(),
        area.getAreaType().getCode(),
        geometryTextCodec.toWkt(area.getGeometry()),
        area.getStartLabel(),
        area.getEndLabel(),
        area.getBufferMeters(),
        area.isActive(),
        area.getCreatedAt());
  }
}
