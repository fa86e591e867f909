package com.realestate.spatial.application.port.in;

import com.realestate.spatial.domain.model.GeocodeOutcome;

/**
 * Input port for turning free text into a coordinate.
 */
public interface GeocodeLocationUseCase {

  /**
   * Resolve a place name, address or literal "lat,lon" pair.
   * Never throws; a miss or an outage is reported in the outcome.
   *
   * @param text free text
   * @return resolution outcome
   */
  GeocodeOutcome resolve(String text);
}
