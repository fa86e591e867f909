package com.realestate.spatial.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Optional descriptive fields stored with a saved area.
 */
@Getter
@AllArgsConstructor
public class AreaMetadata {

    private static final AreaMetadata EMPTY = new AreaMetadata(null, null, null, null);

    private final String description;
    private final String startLabel;
    private final String endLabel;
    private final Integer bufferMeters;

    public static AreaMetadata empty() {
        return EMPTY;
    }
}
