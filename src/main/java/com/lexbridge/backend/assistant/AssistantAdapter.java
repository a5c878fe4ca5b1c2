package com.lexbridge.backend.assistant;

import com.lexbridge.backend.models.Message;

import java.util.List;

/**
 * Conversational interviewer that also extracts structured case facts.
 * Implementations recover from their own failures and always return a reply.
 */
public interface AssistantAdapter {

    /**
     * @param sessionToken token from the previous turn, or null on the first turn
     * @param history      earlier messages of the conversation, oldest first
     * @param newMessage   the client's new message
     */
    AssistantReply respond(String sessionToken, List<Message> history, String newMessage);
}
