package com.realestate.spatial.application.service;

import com.realestate.spatial.api.dto.GeocodeStatsDto;
import com.realestate.spatial.api.dto.ListingCoordinateDto;
import com.realestate.spatial.application.port.in.EnrichCoordinatesUseCase;
import com.realestate.spatial.application.port.in.GeocodeLocationUseCase;
import com.realestate.spatial.application.port.out.ListingRepository;
import com.realestate.spatial.domain.exception.LocationNotResolvedException;
import com.realestate.spatial.domain.exception.ResourceNotFoundException;
import com.realestate.spatial.domain.model.Coordinate;
import com.realestate.spatial.domain.model.EnrichmentReport;
import com.realestate.spatial.domain.model.GeocodeOutcome;
import com.realestate.spatial.domain.model.GeocodeSource;
import com.realestate.spatial.domain.model.Listing;
import com.realestate.spatial.domain.service.LocationQueryHeuristic;
import com.realestate.spatial.infrastructure.config.SpatialProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fills in missing listing coordinates through the external geocoder.
 *
 * Batches run one at a time; each listing is written in its own short
 * transaction so an interrupted batch keeps everything it already stored.
 */
@Service
public class BulkGeocodingService implements EnrichCoordinatesUseCase {

    private static final Logger logger = LoggerFactory.getLogger(BulkGeocodingService.class);

    private final ListingRepository listingRepository;
    private final GeocodeLocationUseCase geocodeLocationUseCase;
    private final LocationQueryHeuristic locationQueryHeuristic;
    private final GeocodeThrottle geocodeThrottle;
    private final SpatialProperties.Enrichment settings;
    private final ReentrantLock batchLock = new ReentrantLock(true);

    public BulkGeocodingService(
            ListingRepository listingRepository,
            GeocodeLocationUseCase geocodeLocationUseCase,
            LocationQueryHeuristic locationQueryHeuristic,
            GeocodeThrottle geocodeThrottle,
            SpatialProperties properties) {
        this.listingRepository = listingRepository;
        this.geocodeLocationUseCase = geocodeLocationUseCase;
        this.locationQueryHeuristic = locationQueryHeuristic;
        this.geocodeThrottle = geocodeThrottle;
        this.settings = properties.getEnrichment();
    }

    @Override
    public EnrichmentReport enrichBatch(int requestedBatchSize) {
        int batchSize = Math.max(1, Math.min(requestedBatchSize, settings.getMaxBatchSize()));

        try {
            batchLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Bulk geocoding cancelled while waiting for the running batch");
            return new EnrichmentReport(0, 0, 0, listingRepository.countActiveWithoutCoordinate(), 0, true);
        }

        try {
            return runBatch(batchSize);
        } finally {
            batchLock.unlock();
        }
    }

    private EnrichmentReport runBatch(int batchSize) {
        List<ListingRepository.PendingGeocode> pending = listingRepository.findPendingGeocoding(batchSize);
        logger.info("Bulk geocoding started: {} candidates (batch size {})", pending.size(), batchSize);

        int attempted = 0;
        int succeeded = 0;
        int failed = 0;
        int providerCalls = 0;
        long totalLatencyMs = 0;
        boolean cancelled = false;

        for (ListingRepository.PendingGeocode item : pending) {
            if (Thread.currentThread().isInterrupted()) {
                cancelled = true;
                break;
            }

            String query = locationQueryHeuristic.toQuery(item.getLocationText());
            if (query.isEmpty()) {
                attempted++;
                failed++;
                listingRepository.markGeocodeAttempt(item.getId(), OffsetDateTime.now());
                logger.debug("Listing {} has no usable location text: '{}'", item.getId(), item.getLocationText());
                continue;
            }

            try {
                geocodeThrottle.awaitTurn();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelled = true;
                break;
            }

            attempted++;
            long startedAt = System.nanoTime();
            GeocodeOutcome outcome = geocodeLocationUseCase.resolve(query);
            totalLatencyMs += TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
            providerCalls++;

            if (!outcome.isFound()) {
                failed++;
                listingRepository.markGeocodeAttempt(item.getId(), OffsetDateTime.now());
                logger.debug("Listing {} not geocoded ({}) for query '{}'", item.getId(), outcome.getStatus(), query);
                continue;
            }

            Coordinate coordinate = outcome.getCoordinate();
            int updated = listingRepository.updateCoordinateIfMissing(item.getId(), coordinate.getLatitude(),
                    coordinate.getLongitude(), GeocodeSource.EXTERNAL_GEOCODER, OffsetDateTime.now());
            if (updated == 0) {
                logger.debug("Listing {} received a coordinate concurrently, keeping it", item.getId());
            }
            succeeded++;
        }

        long remaining = listingRepository.countActiveWithoutCoordinate();
        long averageLatencyMs = providerCalls > 0 ? totalLatencyMs / providerCalls : 0;

        if (cancelled) {
            logger.info("Bulk geocoding cancelled after {} listings: {} succeeded, {} failed",
                    attempted, succeeded, failed);
        } else {
            logger.info("Bulk geocoding finished: attempted={}, succeeded={}, failed={}, remaining={}, avgMs={}",
                    attempted, succeeded, failed, remaining, averageLatencyMs);
        }
        return new EnrichmentReport(attempted, succeeded, failed, remaining, averageLatencyMs, cancelled);
    }

    @Override
    public GeocodeStatsDto geocodeStats() {
        Map<String, Long> bySource = new LinkedHashMap<>();
        for (GeocodeSource source : GeocodeSource.values()) {
            bySource.put(source.getCode(), 0L);
        }
        listingRepository.countBySource().forEach(row -> {
            GeocodeSource source = row.getSource() != null ? row.getSource() : GeocodeSource.NONE;
            bySource.merge(source.getCode(), row.getTotal(), Long::sum);
        });

        return new GeocodeStatsDto(
                listingRepository.count(),
                listingRepository.countWithCoordinate(),
                listingRepository.countActiveWithoutCoordinate(),
                bySource);
    }

    @Override
    public ListingCoordinateDto overrideCoordinate(UUID listingId, Coordinate coordinate) {
        requireListing(listingId);
        int updated = listingRepository.replaceCoordinate(listingId, coordinate.getLatitude(),
                coordinate.getLongitude(), GeocodeSource.MANUAL, OffsetDateTime.now());
        logger.info("Manual coordinate for listing {}: {} (changed={})", listingId, coordinate, updated > 0);
        return new ListingCoordinateDto(listingId, coordinate.getLatitude(), coordinate.getLongitude(),
                GeocodeSource.MANUAL.getCode(), updated > 0);
    }

    @Override
    public ListingCoordinateDto regeocode(UUID listingId) {
        Listing listing = requireListing(listingId);
        String query = locationQueryHeuristic.toQuery(listing.getLocationText());
        if (query.isEmpty()) {
            throw new LocationNotResolvedException("listing", String.valueOf(listing.getLocationText()));
        }

        try {
            geocodeThrottle.awaitTurn();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Re-geocoding cancelled for listing " + listingId);
        }

        GeocodeOutcome outcome = geocodeLocationUseCase.resolve(query);
        if (!outcome.isFound()) {
            throw new LocationNotResolvedException("listing", query);
        }

        Coordinate coordinate = outcome.getCoordinate();
        int updated = listingRepository.replaceCoordinate(listingId, coordinate.getLatitude(),
                coordinate.getLongitude(), GeocodeSource.EXTERNAL_GEOCODER, OffsetDateTime.now());
        logger.info("Re-geocoded listing {} -> {} (changed={})", listingId, coordinate, updated > 0);
        return new ListingCoordinateDto(listingId, coordinate.getLatitude(), coordinate.getLongitude(),
                GeocodeSource.EXTERNAL_GEOCODER.getCode(), updated > 0);
    }

    private Listing requireListing(UUID listingId) {
        return listingRepository.findById(listingId)
                .orElseThrow(() -> new ResourceNotFoundException("Listing", listingId));
    }
}
