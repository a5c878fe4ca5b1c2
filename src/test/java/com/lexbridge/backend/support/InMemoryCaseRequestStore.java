package com.lexbridge.backend.support;

import com.lexbridge.backend.exception.ConflictException;
import com.lexbridge.backend.exception.ConflictReason;
import com.lexbridge.backend.models.CaseRequest;
import com.lexbridge.backend.models.RequestStatus;
import com.lexbridge.backend.store.CaseRequestStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

public class InMemoryCaseRequestStore implements CaseRequestStore {

    private final Map<String, CaseRequest> requests = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public synchronized CaseRequest create(CaseRequest request) {
        boolean pendingExists = requests.values().stream()
                .anyMatch(r -> r.getCaseId().equals(request.getCaseId()) && r.getStatus() == RequestStatus.PENDING);
        if (pendingExists && request.getStatus() == RequestStatus.PENDING) {
            throw new ConflictException(ConflictReason.REQUEST_ALREADY_PENDING,
                    "Case " + request.getCaseId() + " already has a pending request");
        }
        CaseRequest stored = request.toBuilder().id("req-" + sequence.incrementAndGet()).build();
        requests.put(stored.getId(), stored);
        return stored.toBuilder().build();
    }

    @Override
    public synchronized Optional<CaseRequest> findById(String id) {
        return Optional.ofNullable(requests.get(id)).map(r -> r.toBuilder().build());
    }

    @Override
    public synchronized List<CaseRequest> findByCaseId(String caseId) {
        return requests.values().stream()
                .filter(r -> Objects.equals(caseId, r.getCaseId()))
                .map(r -> r.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<CaseRequest> findPendingByCaseId(String caseId) {
        return requests.values().stream()
                .filter(r -> Objects.equals(caseId, r.getCaseId()) && r.getStatus() == RequestStatus.PENDING)
                .findFirst()
                .map(r -> r.toBuilder().build());
    }

    @Override
    public synchronized List<CaseRequest> findByAdvocateId(String advocateId, RequestStatus status) {
        List<CaseRequest> matching = new ArrayList<>();
        requests.values().stream()
                .filter(r -> Objects.equals(advocateId, r.getAdvocateId()))
                .filter(r -> status == null || r.getStatus() == status)
                .forEach(r -> matching.add(0, r.toBuilder().build()));
        return matching;
    }

    @Override
    public synchronized boolean resolve(String id, RequestStatus outcome, Instant respondedAt, String rejectionReason) {
        CaseRequest current = requests.get(id);
        if (current == null || current.getStatus() != RequestStatus.PENDING) {
            return false;
        }
        requests.put(id, current.toBuilder()
                .status(outcome)
                .respondedAt(respondedAt)
                .rejectionReason(rejectionReason)
                .build());
        return true;
    }

    public synchronized int size() {
        return requests.size();
    }
}
