package com.realestate.spatial.domain.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

/**
 * Where a listing's coordinate came from.
 */
public enum GeocodeSource {
    NONE("none"),
    EXTERNAL_GEOCODER("external-geocoder"),
    MANUAL("manual"),
    PROVIDER_SUPPLIED("provider-supplied");

    // codes written by the scraper before this service owned the column
    private static final Map<String, GeocodeSource> LEGACY_CODES = Map.of(
            "scraper", PROVIDER_SUPPLIED,
            "nominatim", EXTERNAL_GEOCODER);

    private final String code;

    GeocodeSource(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Look up a stored code, accepting the legacy scraper codes as well.
     *
     * @param code stored value, may be null
     * @return the source, {@link #NONE} for null or blank, empty when unknown
     */
    public static Optional<GeocodeSource> lookup(String code) {
        if (code == null || code.isBlank()) {
            return Optional.of(NONE);
        }
        String normalized = code.trim().toLowerCase();
        Optional<GeocodeSource> current = Arrays.stream(values())
                .filter(source -> source.code.equals(normalized))
                .findFirst();
        if (current.isPresent()) {
            return current;
        }
        return Optional.ofNullable(LEGACY_CODES.get(normalized));
    }

    public static GeocodeSource fromCode(String code) {
        return lookup(code)
                .orElseThrow(() -> new IllegalArgumentException("Unknown geocode source: " + code));
    }
}
