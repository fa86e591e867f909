package com.realestate.spatial.application.port.out;

import com.realestate.spatial.domain.model.GeocodeOutcome;

/**
 * Output port for the external forward geocoder.
 * Implementations never throw: outages are reported as
 * {@link GeocodeOutcome.Status#UNAVAILABLE}.
 */
public interface GeocodingPort {

    GeocodeOutcome search(String query);
}
