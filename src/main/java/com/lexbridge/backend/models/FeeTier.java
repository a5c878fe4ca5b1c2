package com.lexbridge.backend.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Fee category of an advocate, also used as the client's budget tier.
 */
public enum FeeTier {
    PREMIUM("premium"),
    STANDARD("standard"),
    AFFORDABLE("affordable"),
    PRO_BONO("pro_bono");

    private final String value;

    FeeTier(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Advocate fee tiers a client with this budget can consider.
     */
    public Set<FeeTier> acceptableAdvocateTiers() {
        switch (this) {
            case PRO_BONO:
                return EnumSet.of(AFFORDABLE, PRO_BONO);
            case AFFORDABLE:
                return EnumSet.of(AFFORDABLE, STANDARD);
            case STANDARD:
                return EnumSet.of(STANDARD, AFFORDABLE, PREMIUM);
            case PREMIUM:
                return EnumSet.of(PREMIUM, STANDARD);
            default:
                throw new IllegalStateException("Unhandled fee tier " + this);
        }
    }

    @JsonCreator
    public static FeeTier fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase().replace(' ', '_').replace('-', '_');
        for (FeeTier candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        return null;
    }
}
