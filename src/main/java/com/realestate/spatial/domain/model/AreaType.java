package com.realestate.spatial.domain.model;

import java.util.Arrays;

public enum AreaType {
    CORRIDOR("corridor"),
    BBOX("bbox"),
    POLYGON("polygon"),
    TRACK_CORRIDOR("track-corridor");

    private final String code;

    AreaType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static AreaType fromCode(String code) {
        return Arrays.stream(values())
                .filter(type -> type.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown area type: " + code));
    }
}
