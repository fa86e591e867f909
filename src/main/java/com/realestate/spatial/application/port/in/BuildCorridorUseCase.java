package com.realestate.spatial.application.port.in;

import com.realestate.spatial.api.dto.CorridorResponseDto;
import com.realestate.spatial.application.dto.CorridorCommand;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;

/**
 * Input port for corridor construction.
 */
public interface BuildCorridorUseCase {

  /**
   * Geocode both endpoints, route between them (or fall back to a straight
   * line), buffer and count the listings inside.
   */
  CorridorResponseDto buildCorridor(CorridorCommand command);

  /**
   * Same as {@link #buildCorridor} but the polyline comes from a GPX upload.
   */
  CorridorResponseDto buildCorridorFromTrack(byte[] trackContent, int bufferMeters, String saveAsName);

  /**
   * Buffer a WGS84 polyline by {@code bufferMeters}.
   */
  Geometry buildCorridorFromLine(LineString line, int bufferMeters);
}
