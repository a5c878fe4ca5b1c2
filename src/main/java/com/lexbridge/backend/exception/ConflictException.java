package com.lexbridge.backend.exception;

import lombok.Getter;

/**
 * The caller's view of the case is stale. Safe to retry after re-reading state.
 */
@Getter
public class ConflictException extends LexBridgeException {

    private final ConflictReason reason;

    public ConflictException(ConflictReason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
