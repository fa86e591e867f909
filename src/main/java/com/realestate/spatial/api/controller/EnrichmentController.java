package com.realestate.spatial.api.controller;

import com.realestate.spatial.api.dto.BulkGeocodeReportDto;
import com.realestate.spatial.api.dto.CoordinateDto;
import com.realestate.spatial.api.dto.EnrichmentSubmissionResponseDto;
import com.realestate.spatial.api.dto.GeocodeStatsDto;
import com.realestate.spatial.api.dto.ListingCoordinateDto;
import com.realestate.spatial.application.mapper.EnrichmentReportMapper;
import com.realestate.spatial.application.port.in.EnrichCoordinatesUseCase;
import com.realestate.spatial.application.port.in.SubmitEnrichmentUseCase;
import com.realestate.spatial.domain.model.Coordinate;
import com.realestate.spatial.domain.model.EnrichmentReport;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Coordinate enrichment for listings. Everything except the stats endpoint
 * sits behind the admin token.
 */
@RestController
@RequestMapping("/api/spatial")
public class EnrichmentController {

    private static final Logger logger = LoggerFactory.getLogger(EnrichmentController.class);

    private final EnrichCoordinatesUseCase enrichCoordinatesUseCase;
    private final SubmitEnrichmentUseCase submitEnrichmentUseCase;
    private final EnrichmentReportMapper enrichmentReportMapper;

    public EnrichmentController(
            EnrichCoordinatesUseCase enrichCoordinatesUseCase,
            SubmitEnrichmentUseCase submitEnrichmentUseCase,
            EnrichmentReportMapper enrichmentReportMapper) {
        this.enrichCoordinatesUseCase = enrichCoordinatesUseCase;
        this.submitEnrichmentUseCase = submitEnrichmentUseCase;
        this.enrichmentReportMapper = enrichmentReportMapper;
    }

    /**
     * POST /api/spatial/bulk-geocode?batchSize=50
     *
     * Runs one batch synchronously. The call takes roughly one second per
     * listing because of the geocoder rate limit.
     */
    @PostMapping("/bulk-geocode")
    public ResponseEntity<BulkGeocodeReportDto> bulkGeocode(
            @RequestParam(defaultValue = "${app.enrichment.default-batch-size:50}") int batchSize) {
        logger.info("Bulk geocoding requested, batchSize={}", batchSize);
        EnrichmentReport report = enrichCoordinatesUseCase.enrichBatch(batchSize);
        return ResponseEntity.ok(enrichmentReportMapper.toDto(report));
    }

    /**
     * POST /api/spatial/bulk-geocode/queue?batchSize=50
     *
     * Queues a batch for the background consumer and returns immediately.
     */
    @PostMapping("/bulk-geocode/queue")
    public ResponseEntity<EnrichmentSubmissionResponseDto> queueBulkGeocode(
            @RequestParam(defaultValue = "${app.enrichment.default-batch-size:50}") int batchSize) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(submitEnrichmentUseCase.submitBatch(batchSize));
    }

    @GetMapping("/geocode-stats")
    public ResponseEntity<GeocodeStatsDto> geocodeStats() {
        return ResponseEntity.ok(enrichCoordinatesUseCase.geocodeStats());
    }

    /**
     * PUT /api/spatial/listings/{id}/coordinate
     */
    @PutMapping("/listings/{id}/coordinate")
    public ResponseEntity<ListingCoordinateDto> overrideCoordinate(
            @PathVariable UUID id,
            @Valid @RequestBody CoordinateDto coordinate) {
        return ResponseEntity.ok(enrichCoordinatesUseCase.overrideCoordinate(id,
                new Coordinate(coordinate.getLatitude(), coordinate.getLongitude())));
    }

    /**
     * POST /api/spatial/listings/{id}/geocode
     */
    @PostMapping("/listings/{id}/geocode")
    public ResponseEntity<ListingCoordinateDto> regeocode(@PathVariable UUID id) {
        return ResponseEntity.ok(enrichCoordinatesUseCase.regeocode(id));
    }
}
