package com.realestate.spatial.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Request for one bulk geocoding batch, sent through Kafka.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class EnrichmentRequestEvent {

    @JsonProperty("id")
    private UUID id;

    @JsonProperty("batchSize")
    private int batchSize;

    @JsonProperty("timestamp")
    private OffsetDateTime timestamp;

    public EnrichmentRequestEvent(int batchSize) {
        this.id = UUID.randomUUID();
        this.batchSize = batchSize;
        this.timestamp = OffsetDateTime.now();
    }
}
