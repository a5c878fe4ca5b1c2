package com.lexbridge.backend.store;

import com.lexbridge.backend.models.Conversation;

import java.util.List;
import java.util.Optional;

public interface ConversationStore {

    Conversation create(Conversation conversation);

    Optional<Conversation> findById(String id);

    List<Conversation> findByClientId(String clientId);

    void update(Conversation conversation);
}
