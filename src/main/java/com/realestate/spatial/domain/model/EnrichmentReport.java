package com.realestate.spatial.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Summary of one bulk geocoding batch.
 */
@Getter
@AllArgsConstructor
@ToString
public class EnrichmentReport {

    private final int attempted;
    private final int succeeded;
    private final int failed;
    private final long remaining;
    private final long averageLatencyMs;
    private final boolean cancelled;
}
