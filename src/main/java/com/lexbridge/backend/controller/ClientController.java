package com.lexbridge.backend.controller;

import com.lexbridge.backend.exception.ValidationException;
import com.lexbridge.backend.models.Case;
import com.lexbridge.backend.models.CaseRequest;
import com.lexbridge.backend.models.Conversation;
import com.lexbridge.backend.models.ConversationPhase;
import com.lexbridge.backend.models.Message;
import com.lexbridge.backend.service.AdvocateMatch;
import com.lexbridge.backend.service.CaseLifecycleManager;
import com.lexbridge.backend.service.ClientTurn;
import com.lexbridge.backend.service.ConversationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/client")
public class ClientController extends AbstractController {

    private final ConversationService conversationService;
    private final CaseLifecycleManager lifecycleManager;

    public ClientController(ConversationService conversationService, CaseLifecycleManager lifecycleManager) {
        this.conversationService = conversationService;
        this.lifecycleManager = lifecycleManager;
    }

    // --- Conversations ---

    @PostMapping("/conversations")
    public ResponseEntity<Conversation> startConversation(@RequestHeader(USER_HEADER) String userId) {
        Conversation conversation = conversationService.startConversation(requireUser(userId));
        return ResponseEntity.status(HttpStatus.CREATED).body(conversation);
    }

    @GetMapping("/conversations")
    public ResponseEntity<List<Conversation>> listConversations(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(conversationService.listConversations(requireUser(userId)));
    }

    @GetMapping("/conversations/{conversationId}")
    public ResponseEntity<Map<String, Object>> getConversation(@RequestHeader(USER_HEADER) String userId,
                                                               @PathVariable String conversationId) {
        String clientId = requireUser(userId);
        Conversation conversation = conversationService.getConversation(conversationId, clientId);
        List<Message> messages = conversationService.listMessages(conversationId, clientId);
        return ResponseEntity.ok(Map.of("conversation", conversation, "messages", messages));
    }

    @PostMapping("/conversations/{conversationId}/messages")
    public ResponseEntity<ClientTurn> postMessage(@RequestHeader(USER_HEADER) String userId,
                                                  @PathVariable String conversationId,
                                                  @RequestBody MessageRequest payload) {
        ClientTurn turn = conversationService.postClientMessage(conversationId, requireUser(userId),
                payload != null ? payload.content() : null);
        return ResponseEntity.ok(turn);
    }

    @PostMapping("/conversations/{conversationId}/phase")
    public ResponseEntity<Conversation> advancePhase(@RequestHeader(USER_HEADER) String userId,
                                                     @PathVariable String conversationId,
                                                     @RequestBody PhaseRequest payload) {
        ConversationPhase target = payload != null ? ConversationPhase.fromValue(payload.phase()) : null;
        if (target == null) {
            throw new ValidationException("Unknown conversation phase");
        }
        return ResponseEntity.ok(conversationService.advancePhase(conversationId, requireUser(userId), target));
    }

    // --- Cases ---

    @GetMapping("/cases")
    public ResponseEntity<List<Case>> listCases(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(lifecycleManager.listCasesForClient(requireUser(userId)));
    }

    @GetMapping("/cases/{caseId}")
    public ResponseEntity<Case> getCase(@RequestHeader(USER_HEADER) String userId, @PathVariable String caseId) {
        return ResponseEntity.ok(lifecycleManager.getCase(caseId, requireUser(userId)));
    }

    @GetMapping("/cases/{caseId}/recommendations")
    public ResponseEntity<List<AdvocateMatch>> recommendations(@RequestHeader(USER_HEADER) String userId,
                                                               @PathVariable String caseId,
                                                               @RequestParam(defaultValue = "0") int limit,
                                                               @RequestParam(defaultValue = "true") boolean excludeRejected) {
        return ResponseEntity.ok(lifecycleManager.listRecommendations(caseId, requireUser(userId), excludeRejected, limit));
    }

    @PostMapping("/cases/{caseId}/select-advocate")
    public ResponseEntity<CaseRequest> selectAdvocate(@RequestHeader(USER_HEADER) String userId,
                                                      @PathVariable String caseId,
                                                      @RequestBody SelectAdvocateRequest payload) {
        if (payload == null || payload.advocateId() == null || payload.advocateId().isBlank()) {
            throw new ValidationException("advocateId is required");
        }
        CaseRequest request = lifecycleManager.selectAdvocate(caseId, requireUser(userId), payload.advocateId());
        return ResponseEntity.status(HttpStatus.CREATED).body(request);
    }

    @GetMapping("/cases/{caseId}/requests")
    public ResponseEntity<List<CaseRequest>> listRequests(@RequestHeader(USER_HEADER) String userId,
                                                          @PathVariable String caseId) {
        return ResponseEntity.ok(lifecycleManager.listRequestsForCase(caseId, requireUser(userId)));
    }

    public record MessageRequest(String content) {
    }

    public record PhaseRequest(String phase) {
    }

    public record SelectAdvocateRequest(String advocateId) {
    }
}
