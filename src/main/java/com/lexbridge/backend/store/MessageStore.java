package com.lexbridge.backend.store;

import com.lexbridge.backend.models.Message;

import java.util.List;

/**
 * Append-only message log per conversation.
 */
public interface MessageStore {

    Message append(Message message);

    /** Whole log, oldest first. */
    List<Message> findByConversationId(String conversationId);

    /** The last {@code limit} messages, oldest first. */
    List<Message> findRecent(String conversationId, int limit);

    long countByConversationId(String conversationId);
}
