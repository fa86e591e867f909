package com.realestate.spatial.application.service;

import com.realestate.spatial.application.port.in.GeocodeLocationUseCase;
import com.realestate.spatial.application.port.out.GeocodingPort;
import com.realestate.spatial.domain.model.Coordinate;
import com.realestate.spatial.domain.model.GeocodeOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves free text to a coordinate.
 * Literal "lat,lon" input is parsed locally; anything else goes to the
 * external geocoder. Only successful lookups are cached.
 */
@Service
public class GeocodingService implements GeocodeLocationUseCase {

    private static final Logger logger = LoggerFactory.getLogger(GeocodingService.class);

    private static final Pattern LAT_LON = Pattern.compile(
            "^\\s*([-+]?\\d{1,3}(?:\\.\\d+)?)\\s*,\\s*([-+]?\\d{1,3}(?:\\.\\d+)?)\\s*$");

    private final GeocodingPort geocodingPort;

    public GeocodingService(GeocodingPort geocodingPort) {
        this.geocodingPort = geocodingPort;
    }

    @Override
    @Cacheable(cacheNames = "geocode", key = "#text.trim().toLowerCase()",
            condition = "#text != null", unless = "#result == null || !#result.found")
    public GeocodeOutcome resolve(String text) {
        if (text == null || text.isBlank()) {
            return GeocodeOutcome.notFound();
        }

        GeocodeOutcome literal = parseLiteralCoordinate(text);
        if (literal != null) {
            logger.debug("Using literal coordinate '{}'", text);
            return literal;
        }

        GeocodeOutcome outcome = geocodingPort.search(text.trim());
        if (outcome.isFound()) {
            logger.info("Geocoded '{}' -> {}", text, outcome.getCoordinate());
        } else if (outcome.getStatus() == GeocodeOutcome.Status.UNAVAILABLE) {
            logger.warn("Geocoder unavailable while resolving '{}'", text);
        } else {
            logger.info("No geocoding match for '{}'", text);
        }
        return outcome;
    }

    /**
     * @return FOUND outcome for an in-range "lat,lon" pair, otherwise null
     */
    static GeocodeOutcome parseLiteralCoordinate(String text) {
        Matcher matcher = LAT_LON.matcher(text);
        if (!matcher.matches()) {
            return null;
        }
        double lat = Double.parseDouble(matcher.group(1));
        double lon = Double.parseDouble(matcher.group(2));
        if (!Coordinate.isValid(lat, lon)) {
            return null;
        }
        return GeocodeOutcome.found(new Coordinate(lat, lon), text.trim());
    }
}
