package com.lexbridge.backend.service;

import com.lexbridge.backend.assistant.AssistantAdapter;
import com.lexbridge.backend.assistant.AssistantReply;
import com.lexbridge.backend.config.LexBridgeProperties;
import com.lexbridge.backend.exception.ConflictException;
import com.lexbridge.backend.exception.ConflictReason;
import com.lexbridge.backend.exception.NotFoundException;
import com.lexbridge.backend.exception.ValidationException;
import com.lexbridge.backend.models.Case;
import com.lexbridge.backend.models.CaseProfile;
import com.lexbridge.backend.models.Conversation;
import com.lexbridge.backend.models.ConversationPhase;
import com.lexbridge.backend.models.Message;
import com.lexbridge.backend.models.NotificationType;
import com.lexbridge.backend.models.SenderType;
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

/**
 * Client conversations: the assistant interview while the case is being
 * described, and message relay between client and advocate once one is
 * assigned.
 *
 * <p>The assistant is called without holding any lock; only the writes around
 * it are serialized.
 */
@Slf4j
@Service
public class ConversationService {

    static final String GREETING = """
            Welcome! I'm your legal assistant. I'm here to help you with your legal matter.

            To provide you with the best assistance, I'll need to understand your situation. Let's start with some questions.

            **What type of legal matter do you need help with?**

            1. Civil Dispute (property, contracts, recovery)
            2. Matrimonial (divorce, maintenance, custody)
            3. Criminal/Bail
            4. Property/Conveyancing
            5. Constitutional/Writ
            6. Other

            Please describe your legal issue, and I'll guide you through the process.""";

    private static final int PREVIEW_LENGTH = 100;

    private final ConversationStore conversationStore;
    private final MessageStore messageStore;
    private final CaseLifecycleManager lifecycleManager;
    private final AssistantAdapter assistant;
    private final NotificationGateway notificationGateway;
    private final TransactionRunner transactionRunner;
    private final KeyedLocks locks;
    private final int historyWindow;

    public ConversationService(ConversationStore conversationStore,
                               MessageStore messageStore,
                               CaseLifecycleManager lifecycleManager,
                               AssistantAdapter assistant,
                               NotificationGateway notificationGateway,
                               TransactionRunner transactionRunner,
                               KeyedLocks locks,
                               LexBridgeProperties properties) {
        this.conversationStore = conversationStore;
        this.messageStore = messageStore;
        this.lifecycleManager = lifecycleManager;
        this.assistant = assistant;
        this.notificationGateway = notificationGateway;
        this.transactionRunner = transactionRunner;
        this.locks = locks;
        this.historyWindow = properties.getAssistant().getHistoryWindow();
    }

    public Conversation startConversation(String clientId) {
        if (clientId == null || clientId.isBlank()) {
            throw new ValidationException("Client id is required");
        }
        Instant now = Instant.now();
        Conversation conversation = transactionRunner.inTransaction(() -> {
            Conversation created = conversationStore.create(Conversation.builder()
                    .clientId(clientId)
                    .phase(ConversationPhase.AI_INTERVIEW)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
            messageStore.append(Message.builder()
                    .conversationId(created.getId())
                    .senderType(SenderType.AI)
                    .content(GREETING)
                    .createdAt(now)
                    .build());
            return created;
        });
        log.info("Client {} started conversation {}", clientId, conversation.getId());
        return conversation;
    }

    public ClientTurn postClientMessage(String conversationId, String clientId, String content) {
        String text = requireContent(content);
        Conversation conversation = loadConversation(conversationId, clientId);

        if (!conversation.getPhase().isAssistantTurn()) {
            return relayToAdvocate(conversation, clientId, text);
        }

        List<Message> history = messageStore.findRecent(conversationId, historyWindow);
        Message clientMessage = messageStore.append(Message.builder()
                .conversationId(conversationId)
                .senderType(SenderType.CLIENT)
                .senderId(clientId)
                .content(text)
                .createdAt(Instant.now())
                .build());

        AssistantReply reply = assistant.respond(conversation.getAssistantSessionToken(), history, text);

        if (!Objects.equals(reply.sessionToken(), conversation.getAssistantSessionToken())) {
            storeSessionToken(conversationId, reply.sessionToken());
        }
        Message assistantMessage = messageStore.append(Message.builder()
                .conversationId(conversationId)
                .senderType(SenderType.AI)
                .content(reply.text())
                .createdAt(Instant.now())
                .build());

        CaseProfile before = currentProfile(conversation.getCaseId(), clientId);
        Optional<Case> legalCase = reply.profileFragment().isPresent()
                ? lifecycleManager.ingestCaseProfile(conversation.getCaseId(), clientId, conversationId,
                        reply.profileFragment().get())
                : Optional.ofNullable(conversation.getCaseId()).map(id -> lifecycleManager.getCase(id, clientId));
        CaseProfile after = legalCase.map(Case::getProfile).orElse(null);

        boolean profileUpdated = after != null && !after.equals(before);
        boolean recommendationsAvailable = after != null && after.isScorable();
        if (profileUpdated) {
            log.info("Conversation {} updated the profile of case {}", conversationId, legalCase.get().getId());
        }
        notificationGateway.broadcast(NotificationGateway.conversationTopic(conversationId),
                Map.of("type", "new_message", "data", assistantMessage));
        return new ClientTurn(clientMessage, assistantMessage, legalCase.map(Case::getId).orElse(null),
                profileUpdated, recommendationsAvailable);
    }

    /** A message from the case's assigned advocate to the client. */
    public Message postAdvocateMessage(String caseId, String advocateId, String content) {
        String text = requireContent(content);
        Case legalCase = lifecycleManager.getAssignedCase(caseId, advocateId);
        if (legalCase.getConversationId() == null) {
            throw new ValidationException("Case " + caseId + " has no conversation");
        }
        Message message = messageStore.append(Message.builder()
                .conversationId(legalCase.getConversationId())
                .senderType(SenderType.ADVOCATE)
                .senderId(advocateId)
                .content(text)
                .createdAt(Instant.now())
                .build());
        notificationGateway.broadcast(NotificationGateway.conversationTopic(legalCase.getConversationId()),
                Map.of("type", "new_message", "data", message));
        notificationGateway.notify(legalCase.getClientId(), NotificationType.NEW_MESSAGE,
                "New message from your advocate", preview(text),
                Map.of("case_id", caseId, "conversation_id", legalCase.getConversationId()));
        return message;
    }

    /**
     * Moves a conversation forward. Advocate phases need a case with an
     * assigned advocate.
     */
    public Conversation advancePhase(String conversationId, String clientId, ConversationPhase target) {
        if (target == null) {
            throw new ValidationException("Target phase is required");
        }
        Conversation snapshot = loadConversation(conversationId, clientId);
        String lockKey = snapshot.getCaseId() != null ? snapshot.getCaseId() : "conversation:" + conversationId;
        Conversation advanced = locks.withLock(lockKey, () -> {
            Conversation current = loadConversation(conversationId, clientId);
            ConversationPhase phase = current.getPhase();
            if (!phase.canAdvanceTo(target)) {
                throw new ConflictException(ConflictReason.ILLEGAL_TRANSITION,
                        "Conversation " + conversationId + " cannot move from " + phase.getValue()
                                + " to " + target.getValue());
            }
            if (!target.isAssistantTurn()) {
                boolean assigned = current.getCaseId() != null
                        && lifecycleManager.getCase(current.getCaseId(), clientId).getStatus().hasAssignedAdvocate();
                if (!assigned) {
                    throw new ConflictException(ConflictReason.ILLEGAL_TRANSITION,
                            "Conversation " + conversationId + " has no assigned advocate yet");
                }
            }
            Conversation next = current.toBuilder()
                    .phase(target)
                    .updatedAt(Instant.now())
                    .build();
            conversationStore.update(next);
            return next;
        });
        log.info("Conversation {} moved to {}", conversationId, target.getValue());
        notificationGateway.broadcast(NotificationGateway.conversationTopic(conversationId),
                Map.of("type", "phase_changed", "conversation_id", conversationId, "phase", target.getValue()));
        return advanced;
    }

    // --- Reads ---

    public Conversation getConversation(String conversationId, String clientId) {
        return loadConversation(conversationId, clientId);
    }

    public List<Conversation> listConversations(String clientId) {
        return conversationStore.findByClientId(clientId);
    }

    public List<Message> listMessages(String conversationId, String clientId) {
        loadConversation(conversationId, clientId);
        return messageStore.findByConversationId(conversationId);
    }

    /** The conversation log of a case, as its assigned advocate sees it. */
    public List<Message> listMessagesForCase(String caseId, String advocateId) {
        Case legalCase = lifecycleManager.getAssignedCase(caseId, advocateId);
        return legalCase.getConversationId() != null
                ? messageStore.findByConversationId(legalCase.getConversationId())
                : List.of();
    }

    // --- Helpers ---

    private ClientTurn relayToAdvocate(Conversation conversation, String clientId, String text) {
        Message message = messageStore.append(Message.builder()
                .conversationId(conversation.getId())
                .senderType(SenderType.CLIENT)
                .senderId(clientId)
                .content(text)
                .createdAt(Instant.now())
                .build());
        notificationGateway.broadcast(NotificationGateway.conversationTopic(conversation.getId()),
                Map.of("type", "new_message", "data", message));

        Case legalCase = conversation.getCaseId() != null
                ? lifecycleManager.getCase(conversation.getCaseId(), clientId)
                : null;
        if (legalCase != null && legalCase.getAdvocateId() != null) {
            notificationGateway.notify(legalCase.getAdvocateId(), NotificationType.NEW_MESSAGE,
                    "New message from your client", preview(text),
                    Map.of("case_id", legalCase.getId(), "conversation_id", conversation.getId()));
        }
        boolean scorable = legalCase != null && legalCase.getProfile() != null && legalCase.getProfile().isScorable();
        return new ClientTurn(message, null, legalCase != null ? legalCase.getId() : null, false, scorable);
    }

    private void storeSessionToken(String conversationId, String sessionToken) {
        Conversation snapshot = conversationStore.findById(conversationId)
                .orElseThrow(() -> NotFoundException.conversationNotFound(conversationId));
        String lockKey = snapshot.getCaseId() != null ? snapshot.getCaseId() : "conversation:" + conversationId;
        locks.withLock(lockKey, () -> {
            conversationStore.findById(conversationId).ifPresent(current ->
                    conversationStore.update(current.toBuilder()
                            .assistantSessionToken(sessionToken)
                            .updatedAt(Instant.now())
                            .build()));
            return null;
        });
    }

    private CaseProfile currentProfile(String caseId, String clientId) {
        return caseId != null ? lifecycleManager.getCase(caseId, clientId).getProfile() : null;
    }

    private Conversation loadConversation(String conversationId, String clientId) {
        return conversationStore.findById(conversationId)
                .filter(c -> clientId == null || clientId.equals(c.getClientId()))
                .orElseThrow(() -> NotFoundException.conversationNotFound(conversationId));
    }

    private static String requireContent(String content) {
        if (content == null || content.isBlank()) {
            throw new ValidationException("Message content must not be empty");
        }
        return content.trim();
    }

    private static String preview(String text) {
        return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
    }
}
