package com.lexbridge.backend.service;

import com.lexbridge.backend.models.Notification;
import com.lexbridge.backend.models.NotificationType;
import com.lexbridge.backend.realtime.RealtimeTransport;
import com.lexbridge.backend.store.NotificationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persists user notifications and pushes them to live connections. Sending
 * never fails the caller: lifecycle writes are already committed when it runs.
 */
@Slf4j
@Service
public class NotificationGateway {

    public static final int DEFAULT_PAGE_SIZE = 50;

    private final NotificationStore notificationStore;
    private final RealtimeTransport transport;

    public NotificationGateway(NotificationStore notificationStore, RealtimeTransport transport) {
        this.notificationStore = notificationStore;
        this.transport = transport;
    }

    public void notify(String recipientId, NotificationType type, String title, String message,
                       Map<String, String> data) {
        if (recipientId == null) {
            return;
        }
        Notification notification = Notification.builder()
                .recipientId(recipientId)
                .type(type)
                .title(title)
                .message(message)
                .data(data != null ? new LinkedHashMap<>(data) : Map.of())
                .read(false)
                .createdAt(Instant.now())
                .build();
        try {
            notification = notificationStore.create(notification);
        } catch (RuntimeException e) {
            log.warn("Could not persist {} notification for {}", type.getValue(), recipientId, e);
        }
        try {
            transport.sendToUser(recipientId, Map.of("type", "notification", "data", notification));
        } catch (RuntimeException e) {
            log.warn("Could not push {} notification to {}", type.getValue(), recipientId, e);
        }
    }

    public void broadcast(String topic, Map<String, ?> payload) {
        try {
            transport.broadcast(topic, payload);
        } catch (RuntimeException e) {
            log.warn("Broadcast on {} failed", topic, e);
        }
    }

    public List<Notification> list(String recipientId, boolean unreadOnly, int limit) {
        int pageSize = limit > 0 ? limit : DEFAULT_PAGE_SIZE;
        return notificationStore.findByRecipient(recipientId, unreadOnly, pageSize);
    }

    public long unreadCount(String recipientId) {
        return notificationStore.countUnread(recipientId);
    }

    public boolean markRead(String notificationId, String recipientId) {
        return notificationStore.markRead(notificationId, recipientId);
    }

    public long markAllRead(String recipientId) {
        return notificationStore.markAllRead(recipientId);
    }

    public static String conversationTopic(String conversationId) {
        return "conversation:" + conversationId;
    }
}
