package com.lexbridge.backend.exception;

/**
 * Base type of every failure the case core reports to its callers. None of
 * them leave partial state behind.
 */
public abstract class LexBridgeException extends RuntimeException {

    protected LexBridgeException(String message) {
        super(message);
    }
}
