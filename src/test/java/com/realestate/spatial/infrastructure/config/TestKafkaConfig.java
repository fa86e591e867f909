package com.realestate.spatial.infrastructure.config;

import com.realestate.spatial.application.dto.EnrichmentRequestEvent;
import com.realestate.spatial.application.port.in.EnrichCoordinatesUseCase;
import com.realestate.spatial.application.port.out.EnrichmentRequestPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;

/**
 * Replaces the Kafka publisher in tests: queued batches run synchronously on
 * the calling thread.
 */
@Configuration
@Profile("test")
public class TestKafkaConfig {

    private static final Logger logger = LoggerFactory.getLogger(TestKafkaConfig.class);

    @Bean
    @Primary
    public EnrichmentRequestPublisher synchronousEnrichmentPublisher(@Lazy EnrichCoordinatesUseCase enrichCoordinatesUseCase) {
        return (EnrichmentRequestEvent event) -> {
            logger.info("Test mode: running enrichment request {} synchronously (batch size {})",
                    event.getId(), event.getBatchSize());
            enrichCoordinatesUseCase.enrichBatch(event.getBatchSize());
        };
    }
}
