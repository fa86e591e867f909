package com.realestate.spatial.infrastructure.config;

import com.realestate.spatial.application.dto.EnrichmentRequestEvent;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.kafka.support.serializer.JsonSerializer;
import org.springframework.util.backoff.FixedBackOff;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka configuration for queued bulk geocoding.
 *
 * Excluded from test profile to avoid requiring Kafka during tests.
 */
@Configuration
@Profile("!test")
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrapServers;

    @Value("${app.kafka.consumer-group}")
    private String consumerGroup;

    @Bean
    public ProducerFactory<String, EnrichmentRequestEvent> enrichmentProducerFactory() {
        Map<String, Object> configProps = new HashMap<>();
        configProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        configProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        configProps.put(ProducerConfig.ACKS_CONFIG, "all");
        configProps.put(ProducerConfig.RETRIES_CONFIG, 3);
        return new DefaultKafkaProducerFactory<>(configProps);
    }

    @Bean
    public KafkaTemplate<String, EnrichmentRequestEvent> enrichmentKafkaTemplate() {
        return new KafkaTemplate<>(enrichmentProducerFactory());
    }

    @Bean
    public ConsumerFactory<String, EnrichmentRequestEvent> enrichmentConsumerFactory() {
        Map<String, Object> configProps = new HashMap<>();
        configProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ConsumerConfig.GROUP_ID_CONFIG, consumerGroup);
        configProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        // a full batch at the provider's pace takes minutes
        configProps.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, 900_000);
        configProps.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 1);

        JsonDeserializer<EnrichmentRequestEvent> deserializer = new JsonDeserializer<>(EnrichmentRequestEvent.class, false);
        deserializer.addTrustedPackages("*");
        deserializer.setUseTypeHeaders(false);

        return new DefaultKafkaConsumerFactory<>(configProps, new StringDeserializer(), deserializer);
    }

    /**
     * A failed batch is logged and skipped instead of being redelivered.
     * Listings it did not geocode stay pending for the next request.
     */
    @Bean
    public DefaultErrorHandler enrichmentErrorHandler() {
        return new DefaultErrorHandler(new FixedBackOff(0L, 0L));
    }

    /**
     * Single consumer thread with manual acknowledgment.
     */
    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, EnrichmentRequestEvent> kafkaListenerContainerFactory() {
        ConcurrentKafkaListenerContainerFactory<String, EnrichmentRequestEvent> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(enrichmentConsumerFactory());
        factory.setConcurrency(1);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
        factory.setCommonErrorHandler(enrichmentErrorHandler());
        return factory;
    }
}
