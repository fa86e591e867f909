package com.realestate.spatial.application.mapper;

import com.realestate.spatial.api.dto.MapPointDto;
import com.realestate.spatial.domain.model.ListingPoint;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ListingPointMapper {

  public MapPointDto toDto(ListingPoint point) {
    return new MapPointDto(
        point.getId(),
        point.getTitle(),
        point.getPrice(),
        point.getLocationText(),
        point.getLatitude(),
        point.getLongitude(),
        point.getPropertyType(),
        point.getOfferType(),
        point.getMainPhotoUrl(),
        point.getSourceCode());
  }

  public List<MapPointDto> toDtos(List<ListingPoint> points) {
    return points.stream().map(this::toDto).toList();
  }
}
