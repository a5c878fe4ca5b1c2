package com.lexbridge.backend.realtime;

/**
 * Push channel to connected clients. Delivery is fire-and-forget: a recipient
 * without a live connection simply misses the push and reads the persisted
 * notification later.
 */
public interface RealtimeTransport {

    /** Sends {@code payload} as JSON to every live connection of {@code userId}. */
    void sendToUser(String userId, Object payload);

    /** Sends {@code payload} as JSON to every connection subscribed to {@code topic}. */
    void broadcast(String topic, Object payload);
}
