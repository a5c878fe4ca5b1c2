package com.lexbridge.backend.controller;

import com.lexbridge.backend.exception.ValidationException;

/**
 * Callers identify themselves with the {@code X-User-Id} header. Authentication
 * happens upstream of this service.
 */
public abstract class AbstractController {

    public static final String USER_HEADER = "X-User-Id";

    protected static String requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException(USER_HEADER + " header is required");
        }
        return userId.trim();
    }
}
