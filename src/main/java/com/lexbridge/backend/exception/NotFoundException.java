package com.lexbridge.backend.exception;

public class NotFoundException extends LexBridgeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException caseNotFound(String caseId) {
        return new NotFoundException("Case not found: " + caseId);
    }

    public static NotFoundException requestNotFound(String requestId) {
        return new NotFoundException("Case request not found: " + requestId);
    }

    public static NotFoundException advocateNotFound(String advocateId) {
        return new NotFoundException("Advocate not found: " + advocateId);
    }

    public static NotFoundException conversationNotFound(String conversationId) {
        return new NotFoundException("Conversation not found: " + conversationId);
    }
}
