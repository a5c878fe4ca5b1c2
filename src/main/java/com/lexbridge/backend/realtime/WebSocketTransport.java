package com.lexbridge.backend.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexbridge.backend.config.LexBridgeProperties;
import com.lexbridge.backend.config.RealtimeConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * WebSocket endpoint at {@code /ws?userId=...}. A connection receives its
 * user's notifications and, after
 * {@code {"type":"subscribe","topic":"conversation:<id>"}}, every broadcast on
 * that topic.
 *
 * <p>Pushes return as soon as the frame is queued. Each session has its own
 * outbox, drained in order on the realtime executor, so a stalled client only
 * delays itself. Sessions are also wrapped in
 * {@link ConcurrentWebSocketSessionDecorator}, which drops a client whose
 * buffer overflows or whose send exceeds the time limit.
 */
@Slf4j
@Component
public class WebSocketTransport extends TextWebSocketHandler implements RealtimeTransport {

    static final String USER_ID_PARAM = "userId";
    static final int MAX_PENDING_FRAMES = 1000;

    private final ObjectMapper mapper;
    private final TaskExecutor sender;
    private final int sendTimeLimitMillis;
    private final int bufferSizeLimitBytes;

    private final Map<String, Outbox> sessions = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> sessionsByUser = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> sessionsByTopic = new ConcurrentHashMap<>();

    public WebSocketTransport(ObjectMapper mapper,
                              LexBridgeProperties properties,
                              @Qualifier(RealtimeConfig.REALTIME_EXECUTOR) TaskExecutor sender) {
        this.mapper = mapper;
        this.sender = sender;
        this.sendTimeLimitMillis = properties.getRealtime().getSendTimeLimitMillis();
        this.bufferSizeLimitBytes = properties.getRealtime().getBufferSizeLimitBytes();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession decorated =
                new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMillis, bufferSizeLimitBytes);
        sessions.put(session.getId(), new Outbox(decorated));
        String userId = userIdOf(session.getUri());
        if (userId != null) {
            sessionsByUser.computeIfAbsent(userId, k -> new CopyOnWriteArraySet<>()).add(session.getId());
            session.getAttributes().put(USER_ID_PARAM, userId);
        }
        log.debug("WebSocket {} connected for user {}", session.getId(), userId);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        sessionsByUser.values().forEach(set -> set.remove(session.getId()));
        sessionsByTopic.values().forEach(set -> set.remove(session.getId()));
        log.debug("WebSocket {} closed ({})", session.getId(), status);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        JsonNode node;
        try {
            node = mapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.debug("Ignoring malformed frame on WebSocket {}", session.getId());
            return;
        }
        String type = node.path("type").asText();
        String topic = node.path("topic").asText(null);
        if (topic == null || topic.isBlank()) {
            return;
        }
        if ("subscribe".equals(type)) {
            sessionsByTopic.computeIfAbsent(topic, k -> new CopyOnWriteArraySet<>()).add(session.getId());
            deliver(session.getId(), mapper.writeValueAsString(Map.of("type", "subscribed", "topic", topic)));
        } else if ("unsubscribe".equals(type)) {
            Set<String> subscribers = sessionsByTopic.get(topic);
            if (subscribers != null) {
                subscribers.remove(session.getId());
            }
        }
    }

    @Override
    public void sendToUser(String userId, Object payload) {
        fanOut(sessionsByUser.get(userId), payload);
    }

    @Override
    public void broadcast(String topic, Object payload) {
        fanOut(sessionsByTopic.get(topic), payload);
    }

    private void fanOut(Set<String> sessionIds, Object payload) {
        if (sessionIds == null || sessionIds.isEmpty()) {
            return;
        }
        String json;
        try {
            json = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize realtime payload", e);
            return;
        }
        for (String sessionId : sessionIds) {
            deliver(sessionId, json);
        }
    }

    private void deliver(String sessionId, String json) {
        Outbox outbox = sessions.get(sessionId);
        if (outbox == null || !outbox.session.isOpen()) {
            return;
        }
        outbox.enqueue(json);
    }

    static String userIdOf(URI uri) {
        if (uri == null) {
            return null;
        }
        String userId = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst(USER_ID_PARAM);
        return userId == null || userId.isBlank() ? null : userId;
    }

    /** Frames waiting for one session. At most one drain task runs per outbox at a time. */
    private final class Outbox {

        private final WebSocketSession session;
        private final Queue<String> pending = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean draining = new AtomicBoolean();

        Outbox(WebSocketSession session) {
            this.session = session;
        }

        void enqueue(String json) {
            if (pending.size() >= MAX_PENDING_FRAMES) {
                log.warn("WebSocket {} has {} frames pending; dropping new frame", session.getId(), pending.size());
                return;
            }
            pending.add(json);
            schedule();
        }

        private void schedule() {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            try {
                sender.execute(this::drain);
            } catch (TaskRejectedException e) {
                draining.set(false);
                log.warn("Realtime sender is saturated; dropping {} queued frame(s) for WebSocket {}",
                        pending.size(), session.getId());
                pending.clear();
            }
        }

        private void drain() {
            String json;
            while ((json = pending.poll()) != null) {
                if (!session.isOpen()) {
                    pending.clear();
                    break;
                }
                try {
                    session.sendMessage(new TextMessage(json));
                } catch (IOException | RuntimeException e) {
                    log.warn("Push to WebSocket {} failed", session.getId(), e);
                }
            }
            draining.set(false);
            if (!pending.isEmpty()) {
                schedule();
            }
        }
    }
}
