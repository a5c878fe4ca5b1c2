package com.lexbridge.backend.support;

import com.lexbridge.backend.models.Message;
import com.lexbridge.backend.store.MessageStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

public class InMemoryMessageStore implements MessageStore {

    private final List<Message> messages = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public synchronized Message append(Message message) {
        Message stored = Message.builder()
                .id("msg-" + sequence.incrementAndGet())
                .conversationId(message.getConversationId())
                .senderType(message.getSenderType())
                .senderId(message.getSenderId())
                .content(message.getContent())
                .createdAt(message.getCreatedAt())
                .build();
        messages.add(stored);
        return stored;
    }

    @Override
    public synchronized List<Message> findByConversationId(String conversationId) {
        return messages.stream()
                .filter(m -> Objects.equals(conversationId, m.getConversationId()))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<Message> findRecent(String conversationId, int limit) {
        List<Message> all = findByConversationId(conversationId);
        return new ArrayList<>(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    @Override
    public synchronized long countByConversationId(String conversationId) {
        return findByConversationId(conversationId).size();
    }
}
