package com.lexbridge.backend.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Who owns the next turn of a conversation. Declaration order is the only
 * direction a conversation may move in.
 */
public enum ConversationPhase {
    AI_INTERVIEW("ai_interview", true),
    AI_COUNSELLING("ai_counselling", true),
    AI_DRAFTING("ai_drafting", true),
    ADVOCATE_REVIEW("advocate_review", false),
    ADVOCATE_ACTIVE("advocate_active", false);

    private final String value;
    private final boolean assistantTurn;

    ConversationPhase(String value, boolean assistantTurn) {
        this.value = value;
        this.assistantTurn = assistantTurn;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isAssistantTurn() {
        return assistantTurn;
    }

    /**
     * Forward moves only. Entering an advocate phase additionally requires the
     * linked case to have an assigned advocate, which the caller checks.
     */
    public boolean canAdvanceTo(ConversationPhase next) {
        return next != null && next.ordinal() > ordinal();
    }

    @JsonCreator
    public static ConversationPhase fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        for (ConversationPhase candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        return null;
    }
}
