package com.realestate.spatial.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class GeocodeStatsDto {

    @JsonProperty("total")
    private long total;

    @JsonProperty("withCoordinates")
    private long withCoordinates;

    @JsonProperty("activeWithoutCoordinates")
    private long activeWithoutCoordinates;

    @JsonProperty("bySource")
    private Map<String, Long> bySource;
}
