package com.realestate.spatial.domain.exception;

/**
 * A corridor endpoint (or a listing's location text) could not be turned into
 * a coordinate.
 */
public class LocationNotResolvedException extends RuntimeException {

    private final String role;
    private final String input;

    public LocationNotResolvedException(String role, String input) {
        super("Could not resolve " + role + " location: " + input);
        this.role = role;
        this.input = input;
    }

    public String getRole() {
        return role;
    }

    public String getInput() {
        return input;
    }
}
