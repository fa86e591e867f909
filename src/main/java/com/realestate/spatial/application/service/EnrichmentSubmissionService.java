package com.realestate.spatial.application.service;

import com.realestate.spatial.api.dto.EnrichmentSubmissionResponseDto;
import com.realestate.spatial.application.dto.EnrichmentRequestEvent;
import com.realestate.spatial.application.port.in.SubmitEnrichmentUseCase;
import com.realestate.spatial.application.port.out.EnrichmentRequestPublisher;
import com.realestate.spatial.infrastructure.config.SpatialProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Queues bulk geocoding batches for the background consumer.
 */
@Service
public class EnrichmentSubmissionService implements SubmitEnrichmentUseCase {

    private static final Logger logger = LoggerFactory.getLogger(EnrichmentSubmissionService.class);

    private final EnrichmentRequestPublisher publisher;
    private final int maxBatchSize;

    public EnrichmentSubmissionService(EnrichmentRequestPublisher publisher, SpatialProperties properties) {
        this.publisher = publisher;
        this.maxBatchSize = properties.getEnrichment().getMaxBatchSize();
    }

    @Override
    public EnrichmentSubmissionResponseDto submitBatch(int batchSize) {
        int clamped = Math.max(1, Math.min(batchSize, maxBatchSize));
        EnrichmentRequestEvent event = new EnrichmentRequestEvent(clamped);
        publisher.publish(event);
        logger.info("Queued bulk geocoding request {} (batch size {})", event.getId(), clamped);
        return new EnrichmentSubmissionResponseDto(event.getId(), clamped, "QUEUED");
    }
}
