package com.realestate.spatial.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

/**
 * Returned immediately when a bulk geocoding batch is queued.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class EnrichmentSubmissionResponseDto {

    @JsonProperty("requestId")
    private UUID requestId;

    @JsonProperty("batchSize")
    private int batchSize;

    @JsonProperty("status")
    private String status = "QUEUED";
}
