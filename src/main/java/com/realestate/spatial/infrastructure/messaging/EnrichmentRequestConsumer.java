package com.realestate.spatial.infrastructure.messaging;

import com.realestate.spatial.application.dto.EnrichmentRequestEvent;
import com.realestate.spatial.application.port.in.EnrichCoordinatesUseCase;
import com.realestate.spatial.domain.model.EnrichmentReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Runs queued bulk geocoding batches.
 * The listener container runs a single consumer thread, so batches never
 * overlap and the geocoder sees one caller.
 *
 * Excluded from test profile to avoid requiring Kafka during tests.
 */
@Component
@Profile("!test")
public class EnrichmentRequestConsumer {

    private static final Logger logger = LoggerFactory.getLogger(EnrichmentRequestConsumer.class);

    private final EnrichCoordinatesUseCase enrichCoordinatesUseCase;

    public EnrichmentRequestConsumer(EnrichCoordinatesUseCase enrichCoordinatesUseCase) {
        this.enrichCoordinatesUseCase = enrichCoordinatesUseCase;
    }

    @KafkaListener(topics = "${app.kafka.enrichment-topic}", groupId = "${app.kafka.consumer-group}",
            containerFactory = "kafkaListenerContainerFactory")
    public void consumeEnrichmentRequest(
            @Payload EnrichmentRequestEvent event,
            Acknowledgment acknowledgment,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset) {

        logger.info("Received enrichment request: requestId={}, batchSize={}, partition={}, offset={}",
                event.getId(), event.getBatchSize(), partition, offset);

        try {
            EnrichmentReport report = enrichCoordinatesUseCase.enrichBatch(event.getBatchSize());
            logger.info("Enrichment request {} done: {}", event.getId(), report);
        } catch (RuntimeException e) {
            logger.error("Enrichment request {} failed", event.getId(), e);
            throw e;
        } finally {
            // the container's error handler skips the record; pending listings wait for the next request
            if (acknowledgment != null) {
                acknowledgment.acknowledge();
            }
        }
    }
}
