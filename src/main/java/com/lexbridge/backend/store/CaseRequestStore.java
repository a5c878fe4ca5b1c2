package com.lexbridge.backend.store;

import com.lexbridge.backend.models.CaseRequest;
import com.lexbridge.backend.models.RequestStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface CaseRequestStore {

    /**
     * Inserts a new request.
     *
     * @throws com.lexbridge.backend.exception.ConflictException if the case already has a pending request
     */
    CaseRequest create(CaseRequest request);

    Optional<CaseRequest> findById(String id);

    /** Oldest first. */
    List<CaseRequest> findByCaseId(String caseId);

    Optional<CaseRequest> findPendingByCaseId(String caseId);

    /** Newest first; {@code status} null means any status. */
    List<CaseRequest> findByAdvocateId(String advocateId, RequestStatus status);

    /**
     * Moves a pending request to a terminal status.
     *
     * @return false when the request was no longer pending
     */
    boolean resolve(String id, RequestStatus outcome, Instant respondedAt, String rejectionReason);
}
