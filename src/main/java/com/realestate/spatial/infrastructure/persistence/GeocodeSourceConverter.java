package com.realestate.spatial.infrastructure.persistence;

import com.realestate.spatial.domain.model.GeocodeSource;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores {@link GeocodeSource} by its lower-case code ("external-geocoder").
 * Rows written by the scraper ("scraper", "nominatim") are read as their
 * current equivalents; anything else unknown is read as {@link GeocodeSource#NONE}.
 */
@Converter(autoApply = true)
public class GeocodeSourceConverter implements AttributeConverter<GeocodeSource, String> {

    private static final Logger logger = LoggerFactory.getLogger(GeocodeSourceConverter.class);

    @Override
    public String convertToDatabaseColumn(GeocodeSource source) {
        return source == null ? GeocodeSource.NONE.getCode() : source.getCode();
    }

    @Override
    public GeocodeSource convertToEntityAttribute(String code) {
        return GeocodeSource.lookup(code).orElseGet(() -> {
            logger.warn("Unknown geocode_source value '{}', treating it as '{}'", code, GeocodeSource.NONE.getCode());
            return GeocodeSource.NONE;
        });
    }
}
