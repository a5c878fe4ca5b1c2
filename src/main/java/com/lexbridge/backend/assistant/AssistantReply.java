package com.lexbridge.backend.assistant;

import com.lexbridge.backend.models.CaseProfile;

import java.util.Optional;

/**
 * One assistant turn: the text shown to the client, the session token to pass
 * on the next turn, and a profile fragment when the reply carried one.
 */
public record AssistantReply(String text, String sessionToken, Optional<CaseProfile> profileFragment) {

    public AssistantReply {
        profileFragment = profileFragment != null ? profileFragment : Optional.empty();
    }

    public static AssistantReply textOnly(String text, String sessionToken) {
        return new AssistantReply(text, sessionToken, Optional.empty());
    }
}
