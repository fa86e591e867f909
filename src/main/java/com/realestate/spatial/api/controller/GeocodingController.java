package com.realestate.spatial.api.controller;

import com.realestate.spatial.api.dto.GeocodeResponseDto;
import com.realestate.spatial.application.port.in.GeocodeLocationUseCase;
import com.realestate.spatial.domain.exception.LocationNotResolvedException;
import com.realestate.spatial.domain.model.GeocodeOutcome;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/spatial")
@Validated
public class GeocodingController {

    private static final Logger logger = LoggerFactory.getLogger(GeocodingController.class);

    private final GeocodeLocationUseCase geocodeLocationUseCase;

    public GeocodingController(GeocodeLocationUseCase geocodeLocationUseCase) {
        this.geocodeLocationUseCase = geocodeLocationUseCase;
    }

    /**
     * GET /api/spatial/geocode?address=...
     *
     * @param address place name, address or "lat,lon"
     * @return resolved coordinate, 404 if the text cannot be resolved
     */
    @GetMapping("/geocode")
    public ResponseEntity<GeocodeResponseDto> geocode(@RequestParam @NotBlank String address) {
        logger.info("Geocoding '{}'", address);
        GeocodeOutcome outcome = geocodeLocationUseCase.resolve(address);
        if (!outcome.isFound()) {
            throw new LocationNotResolvedException("address", address);
        }
        return ResponseEntity.ok(new GeocodeResponseDto(
                address,
                outcome.getCoordinate().getLatitude(),
                outcome.getCoordinate().getLongitude(),
                outcome.getDisplayName()));
    }
}
