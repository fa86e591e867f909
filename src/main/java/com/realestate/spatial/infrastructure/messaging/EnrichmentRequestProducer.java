package com.realestate.spatial.infrastructure.messaging;

import com.realestate.spatial.application.dto.EnrichmentRequestEvent;
import com.realestate.spatial.application.port.out.EnrichmentRequestPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes bulk geocoding requests to Kafka.
 */
@Service
public class EnrichmentRequestProducer implements EnrichmentRequestPublisher {

    private static final Logger logger = LoggerFactory.getLogger(EnrichmentRequestProducer.class);

    private final KafkaTemplate<String, EnrichmentRequestEvent> kafkaTemplate;
    private final String enrichmentTopic;

    public EnrichmentRequestProducer(
            KafkaTemplate<String, EnrichmentRequestEvent> kafkaTemplate,
            @Value("${app.kafka.enrichment-topic}") String enrichmentTopic) {
        this.kafkaTemplate = kafkaTemplate;
        this.enrichmentTopic = enrichmentTopic;
    }

    @Override
    public void publish(EnrichmentRequestEvent event) {
        send(event);
    }

    /**
     * Send an enrichment request to the topic, keyed by request id.
     *
     * @param event request to send
     * @return future completing with the broker acknowledgement
     */
    public CompletableFuture<SendResult<String, EnrichmentRequestEvent>> send(EnrichmentRequestEvent event) {
        logger.info("Sending enrichment request to Kafka topic {}: requestId={}, batchSize={}",
                enrichmentTopic, event.getId(), event.getBatchSize());

        CompletableFuture<SendResult<String, EnrichmentRequestEvent>> future = kafkaTemplate.send(
                enrichmentTopic,
                event.getId().toString(),
                event);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                logger.info("Enrichment request sent: requestId={}, offset={}",
                        event.getId(), result.getRecordMetadata().offset());
            } else {
                logger.error("Failed to send enrichment request to Kafka: requestId={}", event.getId(), ex);
            }
        });

        return future;
    }
}
