package com.realestate.spatial.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of resolving free text to a coordinate.
 * A miss and an unreachable provider are distinct outcomes so callers can
 * log them differently; neither is an exception.
 */
@Getter
@EqualsAndHashCode
@ToString
public class GeocodeOutcome {

    public enum Status {
        FOUND,
        NOT_FOUND,
        UNAVAILABLE
    }

    private final Status status;
    private final Coordinate coordinate;
    private final String displayName;

    @JsonCreator
    public GeocodeOutcome(
            @JsonProperty("status") Status status,
            @JsonProperty("coordinate") Coordinate coordinate,
            @JsonProperty("displayName") String displayName) {
        this.status = status;
        this.coordinate = coordinate;
        this.displayName = displayName;
    }

    public static GeocodeOutcome found(Coordinate coordinate, String displayName) {
        return new GeocodeOutcome(Status.FOUND, coordinate, displayName);
    }

    public static GeocodeOutcome notFound() {
        return new GeocodeOutcome(Status.NOT_FOUND, null, null);
    }

    public static GeocodeOutcome unavailable() {
        return new GeocodeOutcome(Status.UNAVAILABLE, null, null);
    }

    @JsonIgnore
    public boolean isFound() {
        return status == Status.FOUND;
    }
}
