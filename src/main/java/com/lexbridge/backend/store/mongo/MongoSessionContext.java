package com.lexbridge.backend.store.mongo;

import com.mongodb.client.ClientSession;

/**
 * Holds the client session of the transaction running on the current thread
 * so that every store joins it.
 */
final class MongoSessionContext {

    private static final ThreadLocal<ClientSession> CURRENT = new ThreadLocal<>();

    private MongoSessionContext() {
    }

    static ClientSession current() {
        return CURRENT.get();
    }

    static void bind(ClientSession session) {
        CURRENT.set(session);
    }

    static void clear() {
        CURRENT.remove();
    }
}
