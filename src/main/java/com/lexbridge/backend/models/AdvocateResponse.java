package com.lexbridge.backend.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AdvocateResponse {
    PENDING("pending"),
    ACCEPTED("accepted"),
    REJECTED("rejected");

    private final String value;

    AdvocateResponse(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Returns null for blank or unknown values. */
    @JsonCreator
    public static AdvocateResponse fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase().replace(' ', '_').replace('-', '_');
        for (AdvocateResponse candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        return null;
    }
}
