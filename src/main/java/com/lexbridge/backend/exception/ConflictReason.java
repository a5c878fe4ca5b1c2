package com.lexbridge.backend.exception;

public enum ConflictReason {
    REQUEST_ALREADY_PENDING,
    REQUEST_ALREADY_PROCESSED,
    CASE_ALREADY_ASSIGNED,
    ILLEGAL_TRANSITION,
    PROFILE_ALREADY_EXISTS,
    ENROLLMENT_NUMBER_TAKEN
}
