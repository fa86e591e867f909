package com.realestate.spatial.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CorridorResponseDto {

    @JsonProperty("polygonWkt")
    private String polygonWkt;

    @JsonProperty("start")
    private CoordinateDto start;

    @JsonProperty("end")
    private CoordinateDto end;

    @JsonProperty("bufferMeters")
    private int bufferMeters;

    @JsonProperty("matchCount")
    private long matchCount;

    @JsonProperty("routed")
    private boolean routed;

    @JsonProperty("savedAreaId")
    private UUID savedAreaId;

    @JsonProperty("pointCount")
    private Integer pointCount;

    @JsonProperty("listings")
    private List<MapPointDto> listings;
}
