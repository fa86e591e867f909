package com.realestate.spatial.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Corridor between two places. Each endpoint is a place name or a
 * "lat,lon" pair.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CorridorRequestDto {

    @NotBlank(message = "start is required")
    @JsonProperty("start")
    private String start;

    @NotBlank(message = "end is required")
    @JsonProperty("end")
    private String end;

    @NotNull(message = "bufferMeters is required")
    @JsonProperty("bufferMeters")
    private Integer bufferMeters;

    @JsonProperty("useRoute")
    private Boolean useRoute = Boolean.TRUE;

    @Size(max = 200)
    @JsonProperty("saveAsName")
    private String saveAsName;

    @Size(max = 2000)
    @JsonProperty("description")
    private String description;

    @JsonProperty("includeListings")
    private Boolean includeListings = Boolean.FALSE;
}
