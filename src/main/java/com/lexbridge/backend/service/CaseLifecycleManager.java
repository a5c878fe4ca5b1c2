package com.lexbridge.backend.service;

import com.lexbridge.backend.config.LexBridgeProperties;
import com.lexbridge.backend.exception.ConflictException;
import com.lexbridge.backend.exception.ConflictReason;
import com.lexbridge.backend.exception.NotFoundException;
import com.lexbridge.backend.exception.ValidationException;
import com.lexbridge.backend.graph.CaseGraph;
import com.lexbridge.backend.models.AdvocateCapability;
import com.lexbridge.backend.models.AdvocateResponse;
import com.lexbridge.backend.models.Case;
import com.lexbridge.backend.models.CaseProfile;
import com.lexbridge.backend.models.CaseRequest;
import com.lexbridge.backend.models.CaseStatus;
import com.lexbridge.backend.models.Conversation;
import com.lexbridge.backend.models.ConversationPhase;
import com.lexbridge.backend.models.Message;
import com.lexbridge.backend.models.NotificationType;
import com.lexbridge.backend.models.RequestStatus;
import com.lexbridge.backend.models.SenderType;
import com.lexbridge.backend.store.CaseRequestStore;
import com.lexbridge.backend.store.CaseStore;
import com.lexbridge.backend.store.ConversationStore;
import com.lexbridge.backend.store.MessageStore;
import com.lexbridge.backend.store.TransactionRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Owns every state change of a case and its advocate requests.
 *
 * <p>All mutations of one case run under that case's lock and inside one
 * store transaction. Preconditions are checked before the first write, so a
 * rejected call leaves nothing behind. Notifications and graph updates happen
 * after the transaction commits and never fail the call.
 */
@Slf4j
@Service
public class CaseLifecycleManager {

    private final CaseStore caseStore;
    private final CaseRequestStore caseRequestStore;
    private final ConversationStore conversationStore;
    private final MessageStore messageStore;
    private final AdvocateDirectory advocateDirectory;
    private final MatchingEngine matchingEngine;
    private final TransactionRunner transactionRunner;
    private final KeyedLocks locks;
    private final NotificationGateway notificationGateway;
    private final CaseGraph caseGraph;
    private final int defaultLimit;

    public CaseLifecycleManager(CaseStore caseStore,
                                CaseRequestStore caseRequestStore,
                                ConversationStore conversationStore,
                                MessageStore messageStore,
                                AdvocateDirectory advocateDirectory,
                                MatchingEngine matchingEngine,
                                TransactionRunner transactionRunner,
                                KeyedLocks locks,
                                NotificationGateway notificationGateway,
                                CaseGraph caseGraph,
                                LexBridgeProperties properties) {
        this.caseStore = caseStore;
        this.caseRequestStore = caseRequestStore;
        this.conversationStore = conversationStore;
        this.messageStore = messageStore;
        this.advocateDirectory = advocateDirectory;
        this.matchingEngine = matchingEngine;
        this.transactionRunner = transactionRunner;
        this.locks = locks;
        this.notificationGateway = notificationGateway;
        this.caseGraph = caseGraph;
        this.defaultLimit = properties.getMatching().getDefaultLimit();
    }

    // --- Profile ingestion ---

    /**
     * Merges an extracted profile fragment into a case.
     *
     * <p>With {@code caseId} the fragment goes into that case. Without it the
     * case linked to {@code conversationId} is used, or a new case is opened
     * once the fragment names a matter type. Identical input is a no-op.
     *
     * @return the case, or empty when there is no case yet and the fragment
     *         cannot open one
     */
    public Optional<Case> ingestCaseProfile(String caseId, String clientId, String conversationId,
                                            CaseProfile fragment) {
        CaseProfile safeFragment = fragment != null ? fragment : CaseProfile.EMPTY;
        if (caseId != null) {
            return Optional.of(mergeInto(caseId, clientId, safeFragment));
        }
        if (conversationId != null) {
            Optional<Case> linked = caseStore.findByConversationId(conversationId);
            if (linked.isPresent()) {
                return Optional.of(mergeInto(linked.get().getId(), clientId, safeFragment));
            }
        }
        if (safeFragment.getMatterType() == null || clientId == null) {
            return Optional.empty();
        }

        OpenedCase opened = locks.withLock(conversationLockKey(conversationId, clientId),
                () -> openCase(clientId, conversationId, safeFragment));
        if (!opened.created()) {
            // Another turn opened the case first
            return Optional.of(mergeInto(opened.legalCase().getId(), clientId, safeFragment));
        }
        caseGraph.caseOpened(clientId, opened.legalCase().getId());
        return Optional.of(opened.legalCase());
    }

    private OpenedCase openCase(String clientId, String conversationId, CaseProfile fragment) {
        if (conversationId != null) {
            Optional<Case> linked = caseStore.findByConversationId(conversationId);
            if (linked.isPresent()) {
                return new OpenedCase(linked.get(), false);
            }
        }
        Conversation conversation = conversationId != null
                ? conversationStore.findById(conversationId)
                        .orElseThrow(() -> NotFoundException.conversationNotFound(conversationId))
                : null;
        if (conversation != null && !clientId.equals(conversation.getClientId())) {
            throw NotFoundException.conversationNotFound(conversationId);
        }

        Instant now = Instant.now();
        Case created = transactionRunner.inTransaction(() -> {
            Case legalCase = caseStore.create(Case.builder()
                    .clientId(clientId)
                    .conversationId(conversationId)
                    .profile(CaseProfile.EMPTY.mergedWith(fragment))
                    .status(CaseStatus.AI_CONVERSATION)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
            if (conversation != null) {
                conversationStore.update(conversation.toBuilder()
                        .caseId(legalCase.getId())
                        .updatedAt(now)
                        .build());
            }
            return legalCase;
        });
        log.info("Opened case {} for client {} ({} matter)", created.getId(), clientId,
                created.getProfile().getMatterType().getValue());
        return new OpenedCase(created, true);
    }

    private Case mergeInto(String caseId, String clientId, CaseProfile fragment) {
        return locks.withLock(caseId, () -> {
            Case current = loadCase(caseId, clientId);
            CaseProfile existing = current.getProfile() != null ? current.getProfile() : CaseProfile.EMPTY;
            CaseProfile merged = existing.mergedWith(fragment);
            if (merged.equals(existing)) {
                return current;
            }
            Case updated = current.toBuilder()
                    .profile(merged)
                    .updatedAt(Instant.now())
                    .build();
            if (!caseStore.replaceIfStatus(updated, current.getStatus())) {
                throw new ConflictException(ConflictReason.ILLEGAL_TRANSITION,
                        "Case " + caseId + " changed while its profile was being updated");
            }
            log.debug("Updated profile of case {}", caseId);
            return updated;
        });
    }

    // --- Advocate selection ---

    /**
     * Offers the case to one advocate. The match score and reasons are computed
     * now, against the advocate's current record, and frozen on the request.
     */
    public CaseRequest selectAdvocate(String caseId, String clientId, String advocateId) {
        CaseRequest request = locks.withLock(caseId, () -> {
            Case legalCase = loadCase(caseId, clientId);
            AdvocateCapability advocate = advocateDirectory.get(advocateId);
            CaseProfile profile = legalCase.getProfile() != null ? legalCase.getProfile() : CaseProfile.EMPTY;
            if (!profile.isScorable()) {
                throw new ValidationException("Case " + caseId + " needs a matter type and a state before an advocate can be selected");
            }
            CaseStatus status = legalCase.getStatus();
            if (status.hasAssignedAdvocate()) {
                throw new ConflictException(ConflictReason.CASE_ALREADY_ASSIGNED,
                        "Case " + caseId + " already has an advocate");
            }
            if (status == CaseStatus.PENDING_ADVOCATE || caseRequestStore.findPendingByCaseId(caseId).isPresent()) {
                throw new ConflictException(ConflictReason.REQUEST_ALREADY_PENDING,
                        "Case " + caseId + " is already waiting for an advocate's answer");
            }
            if (!status.canTransitionTo(CaseStatus.PENDING_ADVOCATE)) {
                throw new ConflictException(ConflictReason.ILLEGAL_TRANSITION,
                        "Case " + caseId + " cannot be offered from status " + status.getValue());
            }

            MatchResult match = matchingEngine.score(advocate, profile);
            Instant now = Instant.now();
            return transactionRunner.inTransaction(() -> {
                CaseRequest created = caseRequestStore.create(CaseRequest.builder()
                        .caseId(caseId)
                        .advocateId(advocateId)
                        .clientId(legalCase.getClientId())
                        .matchScore(match.score())
                        .matchReasons(match.reasons())
                        .status(RequestStatus.PENDING)
                        .createdAt(now)
                        .build());
                Case updated = legalCase.toBuilder()
                        .status(CaseStatus.PENDING_ADVOCATE)
                        .selectedAdvocateId(advocateId)
                        .advocateResponse(AdvocateResponse.PENDING)
                        .rejectionReason(null)
                        .updatedAt(now)
                        .build();
                requireStatus(updated, status);
                return created;
            });
        });

        log.info("Case {} offered to advocate {} with request {} (score {})",
                caseId, advocateId, request.getId(), request.getMatchScore());
        notificationGateway.notify(advocateId, NotificationType.CASE_REQUEST, "New Case Request",
                "A client has requested your assistance. Match score: " + Math.round(request.getMatchScore()) + "%",
                Map.of("case_id", caseId,
                        "request_id", request.getId(),
                        "match_score", String.valueOf(request.getMatchScore())));
        caseGraph.caseOffered(caseId, advocateId);
        return request;
    }

    // --- Advocate responses ---

    public Case accept(String requestId, String advocateId) {
        CaseRequest request = loadRequest(requestId, advocateId);
        Accepted accepted = locks.withLock(request.getCaseId(), () -> {
            CaseRequest pending = requirePending(loadRequest(requestId, advocateId));
            Case legalCase = caseStore.findById(pending.getCaseId())
                    .orElseThrow(() -> NotFoundException.caseNotFound(pending.getCaseId()));
            if (legalCase.getStatus() != CaseStatus.PENDING_ADVOCATE) {
                throw new ConflictException(ConflictReason.ILLEGAL_TRANSITION,
                        "Case " + legalCase.getId() + " is not waiting for an advocate");
            }
            AdvocateCapability advocate = advocateDirectory.get(pending.getAdvocateId());
            Conversation conversation = legalCase.getConversationId() != null
                    ? conversationStore.findById(legalCase.getConversationId()).orElse(null)
                    : null;

            Instant now = Instant.now();
            Case assigned = legalCase.toBuilder()
                    .status(CaseStatus.ADVOCATE_ASSIGNED)
                    .advocateId(advocate.getId())
                    .advocateResponse(AdvocateResponse.ACCEPTED)
                    .rejectionReason(null)
                    .updatedAt(now)
                    .build();
            transactionRunner.inTransaction(() -> {
                resolvePending(pending, RequestStatus.ACCEPTED, now, null);
                requireStatus(assigned, CaseStatus.PENDING_ADVOCATE);
                if (conversation != null) {
                    conversationStore.update(conversation.toBuilder()
                            .phase(ConversationPhase.ADVOCATE_ACTIVE)
                            .updatedAt(now)
                            .build());
                    messageStore.append(Message.builder()
                            .conversationId(conversation.getId())
                            .senderType(SenderType.ADVOCATE)
                            .senderId(advocate.getId())
                            .content(introduction(advocate))
                            .createdAt(now)
                            .build());
                }
                advocateDirectory.incrementCaseLoad(advocate.getId());
                return null;
            });
            return new Accepted(assigned, advocate);
        });

        Case assigned = accepted.legalCase();
        log.info("Advocate {} accepted request {} for case {}", accepted.advocate().getId(), requestId, assigned.getId());
        notificationGateway.notify(assigned.getClientId(), NotificationType.ADVOCATE_ACCEPTED,
                "Advocate Accepted Your Case",
                displayName(accepted.advocate()) + " has accepted your case. You can now chat with them directly.",
                Map.of("case_id", assigned.getId(), "advocate_id", accepted.advocate().getId()));
        if (assigned.getConversationId() != null) {
            notificationGateway.broadcast(NotificationGateway.conversationTopic(assigned.getConversationId()),
                    Map.of("type", "phase_changed",
                            "conversation_id", assigned.getConversationId(),
                            "phase", ConversationPhase.ADVOCATE_ACTIVE.getValue()));
        }
        caseGraph.caseAccepted(accepted.advocate().getId(), assigned.getId());
        return assigned;
    }

    public Case reject(String requestId, String advocateId, String reason) {
        CaseRequest request = loadRequest(requestId, advocateId);
        String rejectionReason = reason == null || reason.isBlank() ? null : reason.trim();
        Case rejected = locks.withLock(request.getCaseId(), () -> {
            CaseRequest pending = requirePending(loadRequest(requestId, advocateId));
            Case legalCase = caseStore.findById(pending.getCaseId())
                    .orElseThrow(() -> NotFoundException.caseNotFound(pending.getCaseId()));
            if (legalCase.getStatus() != CaseStatus.PENDING_ADVOCATE) {
                throw new ConflictException(ConflictReason.ILLEGAL_TRANSITION,
                        "Case " + legalCase.getId() + " is not waiting for an advocate");
            }

            Instant now = Instant.now();
            Case updated = legalCase.toBuilder()
                    .status(CaseStatus.ADVOCATE_REJECTED)
                    .advocateResponse(AdvocateResponse.REJECTED)
                    .rejectionReason(rejectionReason)
                    .updatedAt(now)
                    .build();
            transactionRunner.inTransaction(() -> {
                resolvePending(pending, RequestStatus.REJECTED, now, rejectionReason);
                requireStatus(updated, CaseStatus.PENDING_ADVOCATE);
                return null;
            });
            return updated;
        });

        log.info("Advocate {} declined request {} for case {}", request.getAdvocateId(), requestId, rejected.getId());
        String advocateName = advocateDirectory.find(request.getAdvocateId())
                .map(CaseLifecycleManager::displayName)
                .orElse("The advocate");
        StringBuilder message = new StringBuilder(advocateName).append(" is unable to take your case at this time.");
        if (rejectionReason != null) {
            message.append(" Reason: ").append(rejectionReason);
        }
        message.append(" Please select another advocate from the recommendations.");
        notificationGateway.notify(rejected.getClientId(), NotificationType.ADVOCATE_REJECTED,
                "Advocate Unavailable", message.toString(),
                rejectionReason != null
                        ? Map.of("case_id", rejected.getId(), "advocate_id", request.getAdvocateId(), "reason", rejectionReason)
                        : Map.of("case_id", rejected.getId(), "advocate_id", request.getAdvocateId()));
        caseGraph.caseDeclined(request.getAdvocateId(), rejected.getId());
        return rejected;
    }

    // --- Recommendations ---

    public List<AdvocateMatch> listRecommendations(String caseId, String clientId, boolean excludeRejected,
                                                   int limit) {
        Case legalCase = loadCase(caseId, clientId);
        CaseProfile profile = legalCase.getProfile() != null ? legalCase.getProfile() : CaseProfile.EMPTY;
        requireScorable(profile);

        List<AdvocateMatch> ranked = matchingEngine.recommend(profile, advocateDirectory.snapshot(), Integer.MAX_VALUE);
        if (excludeRejected) {
            Set<String> declined = caseRequestStore.findByCaseId(caseId).stream()
                    .filter(r -> r.getStatus() == RequestStatus.REJECTED)
                    .map(CaseRequest::getAdvocateId)
                    .collect(Collectors.toSet());
            ranked = ranked.stream()
                    .filter(m -> !declined.contains(m.advocateId()))
                    .collect(Collectors.toList());
        }
        int effectiveLimit = limit > 0 ? limit : defaultLimit;
        return ranked.size() <= effectiveLimit ? ranked : ranked.subList(0, effectiveLimit);
    }

    /** Ranks the directory for a profile that has no case yet. */
    public List<AdvocateMatch> previewRecommendations(CaseProfile profile, int limit) {
        CaseProfile safeProfile = profile != null ? profile : CaseProfile.EMPTY;
        requireScorable(safeProfile);
        return matchingEngine.recommend(safeProfile, advocateDirectory.snapshot(), limit > 0 ? limit : defaultLimit);
    }

    // --- Post-assignment ---

    /** Moves an assigned case along in_progress, completed and closed. Only its advocate may do so. */
    public Case advanceCaseStatus(String caseId, String advocateId, CaseStatus target) {
        if (target == null) {
            throw new ValidationException("Target status is required");
        }
        Case updated = locks.withLock(caseId, () -> {
            Case legalCase = caseStore.findById(caseId)
                    .filter(c -> advocateId != null && advocateId.equals(c.getAdvocateId()))
                    .orElseThrow(() -> NotFoundException.caseNotFound(caseId));
            CaseStatus current = legalCase.getStatus();
            if (!current.hasAssignedAdvocate() || !current.canTransitionTo(target)) {
                throw new ConflictException(ConflictReason.ILLEGAL_TRANSITION,
                        "Case " + caseId + " cannot move from " + current.getValue() + " to " + target.getValue());
            }
            Case next = legalCase.toBuilder()
                    .status(target)
                    .updatedAt(Instant.now())
                    .build();
            requireStatus(next, current);
            return next;
        });

        log.info("Case {} moved to {} by advocate {}", caseId, target.getValue(), advocateId);
        notificationGateway.notify(updated.getClientId(), NotificationType.CASE_STATUS_CHANGED,
                "Case Status Updated",
                "Your case is now " + target.getValue().replace('_', ' ') + ".",
                Map.of("case_id", caseId, "status", target.getValue()));
        return updated;
    }

    // --- Reads ---

    public Case getCase(String caseId, String clientId) {
        return loadCase(caseId, clientId);
    }

    /** The case as seen by its assigned advocate. */
    public Case getAssignedCase(String caseId, String advocateId) {
        return caseStore.findById(caseId)
                .filter(c -> advocateId != null && advocateId.equals(c.getAdvocateId()))
                .orElseThrow(() -> NotFoundException.caseNotFound(caseId));
    }

    public List<Case> listCasesForClient(String clientId) {
        return caseStore.findByClientId(clientId);
    }

    public List<Case> listCasesForAdvocate(String advocateId) {
        return caseStore.findByAdvocateId(advocateId);
    }

    public List<CaseRequest> listRequestsForAdvocate(String advocateId, RequestStatus status) {
        return caseRequestStore.findByAdvocateId(advocateId, status);
    }

    /** A request addressed to {@code advocateId}, with its case and the conversation so far. */
    public CaseRequestDetail getRequestDetail(String requestId, String advocateId) {
        CaseRequest request = loadRequest(requestId, advocateId);
        Case legalCase = caseStore.findById(request.getCaseId())
                .orElseThrow(() -> NotFoundException.caseNotFound(request.getCaseId()));
        List<Message> messages = legalCase.getConversationId() != null
                ? messageStore.findByConversationId(legalCase.getConversationId())
                : List.of();
        return new CaseRequestDetail(request, legalCase, messages);
    }

    public List<CaseRequest> listRequestsForCase(String caseId, String clientId) {
        loadCase(caseId, clientId);
        return caseRequestStore.findByCaseId(caseId);
    }

    // --- Helpers ---

    /** Loads a case; a {@code clientId} that does not own it sees the case as missing. */
    private Case loadCase(String caseId, String clientId) {
        return caseStore.findById(caseId)
                .filter(c -> clientId == null || clientId.equals(c.getClientId()))
                .orElseThrow(() -> NotFoundException.caseNotFound(caseId));
    }

    private CaseRequest loadRequest(String requestId, String advocateId) {
        return caseRequestStore.findById(requestId)
                .filter(r -> advocateId == null || advocateId.equals(r.getAdvocateId()))
                .orElseThrow(() -> NotFoundException.requestNotFound(requestId));
    }

    private static CaseRequest requirePending(CaseRequest request) {
        if (request.getStatus() != RequestStatus.PENDING) {
            throw new ConflictException(ConflictReason.REQUEST_ALREADY_PROCESSED,
                    "Request " + request.getId() + " has already been " + request.getStatus().getValue());
        }
        return request;
    }

    private void resolvePending(CaseRequest request, RequestStatus outcome, Instant at, String reason) {
        if (!caseRequestStore.resolve(request.getId(), outcome, at, reason)) {
            throw new ConflictException(ConflictReason.REQUEST_ALREADY_PROCESSED,
                    "Request " + request.getId() + " has already been processed");
        }
    }

    private void requireStatus(Case updated, CaseStatus expected) {
        if (!caseStore.replaceIfStatus(updated, expected)) {
            throw new ConflictException(ConflictReason.ILLEGAL_TRANSITION,
                    "Case " + updated.getId() + " is no longer " + expected.getValue());
        }
    }

    private static void requireScorable(CaseProfile profile) {
        if (!profile.isScorable()) {
            throw new ValidationException("Recommendations need a matter type and a state");
        }
    }

    private static String introduction(AdvocateCapability advocate) {
        return "Hello! I'm " + displayName(advocate) + ", and I'll be assisting you with your case from now on. "
                + "I've reviewed our assistant's conversation with you and am ready to help. "
                + "Please feel free to ask any questions or share additional information.";
    }

    private static String displayName(AdvocateCapability advocate) {
        return Objects.requireNonNullElse(advocate.getDisplayName(), "Your advocate");
    }

    private static String conversationLockKey(String conversationId, String clientId) {
        return conversationId != null ? "conversation:" + conversationId : "client:" + clientId;
    }

    private record OpenedCase(Case legalCase, boolean created) {
    }

    private record Accepted(Case legalCase, AdvocateCapability advocate) {
    }
}
