package com.realestate.spatial.application.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Input for building a corridor between two free-text endpoints.
 */
@Getter
@AllArgsConstructor
@ToString
public class CorridorCommand {

    private final String start;
    private final String end;
    private final int bufferMeters;
    private final boolean useRoute;
    private final String saveAsName;
    private final String description;
    private final boolean includeListings;
}
