package com.lexbridge.backend.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CourtLevel {
    DISTRICT("district"),
    HIGH_COURT("high_court"),
    SUPREME_COURT("supreme_court"),
    TRIBUNAL("tribunal");

    private final String value;

    CourtLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Returns null for blank or unknown values. */
    @JsonCreator
    public static CourtLevel fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase().replace(' ', '_').replace('-', '_');
        for (CourtLevel candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        return null;
    }
}
