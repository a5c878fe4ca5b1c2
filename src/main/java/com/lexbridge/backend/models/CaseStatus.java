package com.lexbridge.backend.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a case.
 *
 * <pre>
 * ai_conversation -> pending_advocate -> advocate_assigned | advocate_rejected
 * advocate_rejected -> pending_advocate
 * advocate_assigned -> in_progress -> completed -> closed
 * </pre>
 */
public enum CaseStatus {
    AI_CONVERSATION("ai_conversation"),
    PENDING_ADVOCATE("pending_advocate"),
    ADVOCATE_ASSIGNED("advocate_assigned"),
    ADVOCATE_REJECTED("advocate_rejected"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    CLOSED("closed");

    private final String value;

    CaseStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Set<CaseStatus> successors() {
        switch (this) {
            case AI_CONVERSATION:
            case ADVOCATE_REJECTED:
                return EnumSet.of(PENDING_ADVOCATE);
            case PENDING_ADVOCATE:
                return EnumSet.of(ADVOCATE_ASSIGNED, ADVOCATE_REJECTED);
            case ADVOCATE_ASSIGNED:
                return EnumSet.of(IN_PROGRESS);
            case IN_PROGRESS:
                return EnumSet.of(COMPLETED);
            case COMPLETED:
                return EnumSet.of(CLOSED);
            case CLOSED:
                return EnumSet.noneOf(CaseStatus.class);
            default:
                throw new IllegalStateException("Unhandled case status " + this);
        }
    }

    public boolean canTransitionTo(CaseStatus next) {
        return next != null && successors().contains(next);
    }

    /** True once an advocate has taken the case; advocateId is set exactly in these states. */
    public boolean hasAssignedAdvocate() {
        return this == ADVOCATE_ASSIGNED || this == IN_PROGRESS || this == COMPLETED || this == CLOSED;
    }

    /** True while the client may still offer the case to an advocate. */
    public boolean isSelectable() {
        return this == AI_CONVERSATION || this == ADVOCATE_REJECTED;
    }

    @JsonCreator
    public static CaseStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        for (CaseStatus candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        return null;
    }
}
