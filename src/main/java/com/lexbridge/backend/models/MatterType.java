package com.lexbridge.backend.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MatterType {
    CIVIL("civil"),
    MATRIMONIAL("matrimonial"),
    CRIMINAL("criminal"),
    PROPERTY("property"),
    CONSTITUTIONAL("constitutional"),
    CONVEYANCING("conveyancing"),
    NOTICE("notice");

    private final String value;

    MatterType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Returns null for blank or unknown values. */
    @JsonCreator
    public static MatterType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase().replace(' ', '_').replace('-', '_');
        for (MatterType candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        return null;
    }
}
