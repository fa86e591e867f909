package com.realestate.spatial.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class SavedAreaDto {

    @JsonProperty("id")
    private UUID id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("areaType")
    private String areaType;

    @JsonProperty("geometryWkt")
    private String geometryWkt;

    @JsonProperty("startLabel")
    private String startLabel;

    @JsonProperty("endLabel")
    private String endLabel;

    @JsonProperty("bufferMeters")
    private Integer bufferMeters;

    @JsonProperty("active")
    private boolean active;

    @JsonProperty("createdAt")
    private OffsetDateTime createdAt;
}
