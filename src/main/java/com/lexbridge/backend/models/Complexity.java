package com.lexbridge.backend.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Complexity {
    SIMPLE("simple", 3),
    MODERATE("moderate", 5),
    COMPLEX("complex", 10),
    HIGHLY_COMPLEX("highly_complex", 15);

    private final String value;
    private final int minimumYearsOfPractice;

    Complexity(String value, int minimumYearsOfPractice) {
        this.value = value;
        this.minimumYearsOfPractice = minimumYearsOfPractice;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getMinimumYearsOfPractice() {
        return minimumYearsOfPractice;
    }

    @JsonCreator
    public static Complexity fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase().replace(' ', '_').replace('-', '_');
        for (Complexity candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        return null;
    }
}
