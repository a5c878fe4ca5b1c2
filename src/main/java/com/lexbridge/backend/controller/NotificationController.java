package com.lexbridge.backend.controller;

import com.lexbridge.backend.exception.NotFoundException;
import com.lexbridge.backend.models.Notification;
import com.lexbridge.backend.service.NotificationGateway;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/notifications")
public class NotificationController extends AbstractController {

    private final NotificationGateway notificationGateway;

    public NotificationController(NotificationGateway notificationGateway) {
        this.notificationGateway = notificationGateway;
    }

    @GetMapping
    public ResponseEntity<List<Notification>> list(@RequestHeader(USER_HEADER) String userId,
                                                   @RequestParam(defaultValue = "false") boolean unreadOnly,
                                                   @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(notificationGateway.list(requireUser(userId), unreadOnly, limit));
    }

    @GetMapping("/unread-count")
    public ResponseEntity<Map<String, Long>> unreadCount(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(Map.of("unread", notificationGateway.unreadCount(requireUser(userId))));
    }

    @PostMapping("/{notificationId}/read")
    public ResponseEntity<Void> markRead(@RequestHeader(USER_HEADER) String userId,
                                         @PathVariable String notificationId) {
        if (!notificationGateway.markRead(notificationId, requireUser(userId))) {
            throw new NotFoundException("Notification not found: " + notificationId);
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/read-all")
    public ResponseEntity<Map<String, Long>> markAllRead(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(Map.of("updated", notificationGateway.markAllRead(requireUser(userId))));
    }
}
