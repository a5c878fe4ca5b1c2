package com.lexbridge.backend.support;

import com.lexbridge.backend.models.Conversation;
import com.lexbridge.backend.store.ConversationStore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

public class InMemoryConversationStore implements ConversationStore {

    private final Map<String, Conversation> conversations = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public synchronized Conversation create(Conversation conversation) {
        Conversation stored = conversation.toBuilder().id("conv-" + sequence.incrementAndGet()).build();
        conversations.put(stored.getId(), stored);
        return stored.toBuilder().build();
    }

    @Override
    public synchronized Optional<Conversation> findById(String id) {
        return Optional.ofNullable(conversations.get(id)).map(c -> c.toBuilder().build());
    }

    @Override
    public synchronized List<Conversation> findByClientId(String clientId) {
        return conversations.values().stream()
                .filter(c -> Objects.equals(clientId, c.getClientId()))
                .map(c -> c.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void update(Conversation conversation) {
        conversations.put(conversation.getId(), conversation.toBuilder().build());
    }
}
