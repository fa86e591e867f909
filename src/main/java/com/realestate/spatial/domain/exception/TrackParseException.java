package com.realestate.spatial.domain.exception;

/**
 * Uploaded track could not be turned into a polyline.
 */
public class TrackParseException extends IllegalArgumentException {

    public enum Reason {
        /** Not XML, or XML without a gpx root. */
        UNRECOGNIZED_FORMAT,
        /** Valid track file with fewer than two usable points. */
        EMPTY_TRACK
    }

    private final Reason reason;

    public TrackParseException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TrackParseException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
