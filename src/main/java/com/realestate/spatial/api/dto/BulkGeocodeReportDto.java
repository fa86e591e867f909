package com.realestate.spatial.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class BulkGeocodeReportDto {

    @JsonProperty("attempted")
    private int attempted;

    @JsonProperty("succeeded")
    private int succeeded;

    @JsonProperty("failed")
    private int failed;

    @JsonProperty("remaining")
    private long remaining;

    @JsonProperty("avgLatencyMs")
    private long avgLatencyMs;

    @JsonProperty("cancelled")
    private boolean cancelled;
}
