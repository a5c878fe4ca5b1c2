package com.lexbridge.backend.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationType {
    CASE_REQUEST("case_request"),
    ADVOCATE_ACCEPTED("advocate_accepted"),
    ADVOCATE_REJECTED("advocate_rejected"),
    NEW_MESSAGE("new_message"),
    CASE_STATUS_CHANGED("case_status_changed");

    private final String value;

    NotificationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Returns null for blank or unknown values. */
    @JsonCreator
    public static NotificationType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase().replace(' ', '_').replace('-', '_');
        for (NotificationType candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        return null;
    }
}
