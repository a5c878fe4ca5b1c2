package com.lexbridge.backend.controller;

import com.lexbridge.backend.exception.ValidationException;
import com.lexbridge.backend.models.AdvocateCapability;
import com.lexbridge.backend.models.AdvocateProfileEdit;
import com.lexbridge.backend.models.Case;
import com.lexbridge.backend.models.CaseRequest;
import com.lexbridge.backend.models.CaseStatus;
import com.lexbridge.backend.models.Message;
import com.lexbridge.backend.models.RequestStatus;
import com.lexbridge.backend.service.AdvocateDirectory;
import com.lexbridge.backend.service.CaseLifecycleManager;
import com.lexbridge.backend.service.CaseRequestDetail;
import com.lexbridge.backend.service.ConversationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/advocate")
public class AdvocateController extends AbstractController {

    private final CaseLifecycleManager lifecycleManager;
    private final ConversationService conversationService;
    private final AdvocateDirectory advocateDirectory;

    public AdvocateController(CaseLifecycleManager lifecycleManager,
                              ConversationService conversationService,
                              AdvocateDirectory advocateDirectory) {
        this.lifecycleManager = lifecycleManager;
        this.conversationService = conversationService;
        this.advocateDirectory = advocateDirectory;
    }

    // --- Requests ---

    @GetMapping("/case-requests")
    public ResponseEntity<List<CaseRequest>> listRequests(@RequestHeader(USER_HEADER) String userId,
                                                          @RequestParam(required = false) String status) {
        RequestStatus filter = null;
        if (status != null && !status.isBlank()) {
            filter = RequestStatus.fromValue(status);
            if (filter == null) {
                throw new ValidationException("Unknown request status " + status);
            }
        }
        return ResponseEntity.ok(lifecycleManager.listRequestsForAdvocate(requireUser(userId), filter));
    }

    @GetMapping("/case-requests/{requestId}")
    public ResponseEntity<CaseRequestDetail> getRequest(@RequestHeader(USER_HEADER) String userId,
                                                        @PathVariable String requestId) {
        return ResponseEntity.ok(lifecycleManager.getRequestDetail(requestId, requireUser(userId)));
    }

    @PostMapping("/case-requests/{requestId}/accept")
    public ResponseEntity<Case> accept(@RequestHeader(USER_HEADER) String userId, @PathVariable String requestId) {
        return ResponseEntity.ok(lifecycleManager.accept(requestId, requireUser(userId)));
    }

    @PostMapping("/case-requests/{requestId}/reject")
    public ResponseEntity<Case> reject(@RequestHeader(USER_HEADER) String userId,
                                       @PathVariable String requestId,
                                       @RequestBody(required = false) RejectRequest payload) {
        String reason = payload != null ? payload.reason() : null;
        return ResponseEntity.ok(lifecycleManager.reject(requestId, requireUser(userId), reason));
    }

    // --- Assigned cases ---

    @GetMapping("/cases")
    public ResponseEntity<List<Case>> listCases(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(lifecycleManager.listCasesForAdvocate(requireUser(userId)));
    }

    @PostMapping("/cases/{caseId}/status")
    public ResponseEntity<Case> advanceStatus(@RequestHeader(USER_HEADER) String userId,
                                              @PathVariable String caseId,
                                              @RequestBody StatusRequest payload) {
        CaseStatus target = payload != null ? CaseStatus.fromValue(payload.status()) : null;
        if (target == null) {
            throw new ValidationException("Unknown case status");
        }
        return ResponseEntity.ok(lifecycleManager.advanceCaseStatus(caseId, requireUser(userId), target));
    }

    @GetMapping("/cases/{caseId}/messages")
    public ResponseEntity<List<Message>> listMessages(@RequestHeader(USER_HEADER) String userId,
                                                      @PathVariable String caseId) {
        return ResponseEntity.ok(conversationService.listMessagesForCase(caseId, requireUser(userId)));
    }

    @PostMapping("/cases/{caseId}/messages")
    public ResponseEntity<Message> postMessage(@RequestHeader(USER_HEADER) String userId,
                                               @PathVariable String caseId,
                                               @RequestBody ClientController.MessageRequest payload) {
        Message message = conversationService.postAdvocateMessage(caseId, requireUser(userId),
                payload != null ? payload.content() : null);
        return ResponseEntity.status(HttpStatus.CREATED).body(message);
    }

    // --- Profile ---

    @GetMapping("/profile")
    public ResponseEntity<AdvocateCapability> getProfile(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(advocateDirectory.get(requireUser(userId)));
    }

    @PostMapping("/profile")
    public ResponseEntity<AdvocateCapability> createProfile(@RequestHeader(USER_HEADER) String userId,
                                                            @RequestBody AdvocateProfileEdit profile) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(advocateDirectory.createProfile(requireUser(userId), profile));
    }

    @PutMapping("/profile")
    public ResponseEntity<AdvocateCapability> updateProfile(@RequestHeader(USER_HEADER) String userId,
                                                            @RequestBody AdvocateProfileEdit changes) {
        return ResponseEntity.ok(advocateDirectory.updateProfile(requireUser(userId), changes));
    }

    @PutMapping("/availability")
    public ResponseEntity<Map<String, Object>> setAvailability(@RequestHeader(USER_HEADER) String userId,
                                                               @RequestBody AvailabilityRequest payload) {
        if (payload == null || payload.available() == null) {
            throw new ValidationException("available is required");
        }
        AdvocateCapability updated = advocateDirectory.setAvailability(requireUser(userId), payload.available());
        return ResponseEntity.ok(Map.of(
                "available", updated.isAvailable(),
                "message", "Availability updated successfully"));
    }

    public record RejectRequest(String reason) {
    }

    public record StatusRequest(String status) {
    }

    public record AvailabilityRequest(Boolean available) {
    }
}
