package com.lexbridge.backend.store;

import com.lexbridge.backend.models.Notification;

import java.util.List;

public interface NotificationStore {

    Notification create(Notification notification);

    /** Newest first. */
    List<Notification> findByRecipient(String recipientId, boolean unreadOnly, int limit);

    long countUnread(String recipientId);

    boolean markRead(String id, String recipientId);

    long markAllRead(String recipientId);
}
