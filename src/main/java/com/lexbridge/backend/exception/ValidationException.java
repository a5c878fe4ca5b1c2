package com.lexbridge.backend.exception;

public class ValidationException extends LexBridgeException {

    public ValidationException(String message) {
        super(message);
    }
}
