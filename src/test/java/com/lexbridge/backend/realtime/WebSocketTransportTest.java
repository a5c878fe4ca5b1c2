package com.lexbridge.backend.realtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexbridge.backend.config.LexBridgeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.net.URI;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketTransportTest {

    private WebSocketTransport transport;

    @BeforeEach
    void setUp() {
        transport = new WebSocketTransport(new ObjectMapper(), new LexBridgeProperties(), new SyncTaskExecutor());
    }

    @Test
    void userIdOf_shouldReadQueryParameter() {
        assertThat(WebSocketTransport.userIdOf(URI.create("ws://localhost/ws?userId=client-1"))).isEqualTo("client-1");
        assertThat(WebSocketTransport.userIdOf(URI.create("ws://localhost/ws"))).isNull();
        assertThat(WebSocketTransport.userIdOf(URI.create("ws://localhost/ws?userId="))).isNull();
        assertThat(WebSocketTransport.userIdOf(null)).isNull();
    }

    @Test
    void sendToUser_shouldReachEveryConnectionOfThatUser() throws Exception {
        WebSocketSession phone = session("s1", "client-1");
        WebSocketSession laptop = session("s2", "client-1");
        WebSocketSession other = session("s3", "client-2");
        transport.afterConnectionEstablished(phone);
        transport.afterConnectionEstablished(laptop);
        transport.afterConnectionEstablished(other);

        transport.sendToUser("client-1", Map.of("type", "notification"));

        assertThat(lastPayload(phone)).contains("\"notification\"");
        assertThat(lastPayload(laptop)).contains("\"notification\"");
        verify(other, never()).sendMessage(any());
    }

    @Test
    void sendToUser_shouldSkipFailingConnection() throws Exception {
        WebSocketSession broken = session("s1", "client-1");
        WebSocketSession healthy = session("s2", "client-1");
        doThrow(new IOException("broken pipe")).when(broken).sendMessage(any());
        transport.afterConnectionEstablished(broken);
        transport.afterConnectionEstablished(healthy);

        transport.sendToUser("client-1", Map.of("type", "notification"));

        verify(healthy).sendMessage(any());
    }

    @Test
    void sendToUser_shouldNotWaitForStalledConnection() throws Exception {
        ThreadPoolTaskExecutor pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(2);
        pool.setMaxPoolSize(2);
        pool.initialize();
        CountDownLatch release = new CountDownLatch(1);
        try {
            WebSocketTransport pooled = new WebSocketTransport(new ObjectMapper(), new LexBridgeProperties(), pool);
            WebSocketSession stalled = session("s1", "client-1");
            WebSocketSession healthy = session("s2", "client-1");
            doAnswer(invocation -> {
                release.await(5, TimeUnit.SECONDS);
                return null;
            }).when(stalled).sendMessage(any());
            pooled.afterConnectionEstablished(stalled);
            pooled.afterConnectionEstablished(healthy);

            long started = System.nanoTime();
            pooled.sendToUser("client-1", Map.of("type", "notification"));
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            assertThat(elapsedMillis).isLessThan(1000);
            verify(healthy, timeout(2000)).sendMessage(any());
        } finally {
            release.countDown();
            pool.shutdown();
        }
    }

    @Test
    void sendToUser_shouldDropFrames_whenSenderIsSaturated() throws Exception {
        TaskExecutor saturated = task -> {
            throw new TaskRejectedException("queue full");
        };
        WebSocketTransport rejecting = new WebSocketTransport(new ObjectMapper(), new LexBridgeProperties(), saturated);
        WebSocketSession session = session("s1", "client-1");
        rejecting.afterConnectionEstablished(session);

        rejecting.sendToUser("client-1", Map.of("type", "notification"));

        verify(session, never()).sendMessage(any());
    }

    @Test
    void broadcast_shouldOnlyReachSubscribers() throws Exception {
        WebSocketSession subscriber = session("s1", "client-1");
        WebSocketSession bystander = session("s2", "adv-1");
        transport.afterConnectionEstablished(subscriber);
        transport.afterConnectionEstablished(bystander);

        transport.handleTextMessage(subscriber, new TextMessage("{\"type\":\"subscribe\",\"topic\":\"conversation:conv-1\"}"));
        assertThat(lastPayload(subscriber)).contains("subscribed");

        transport.broadcast("conversation:conv-1", Map.of("type", "new_message"));

        assertThat(lastPayload(subscriber)).contains("new_message");
        verify(bystander, never()).sendMessage(any());
    }

    @Test
    void unsubscribeAndClose_shouldStopDelivery() throws Exception {
        WebSocketSession session = session("s1", "client-1");
        transport.afterConnectionEstablished(session);
        transport.handleTextMessage(session, new TextMessage("{\"type\":\"subscribe\",\"topic\":\"conversation:conv-1\"}"));
        transport.handleTextMessage(session, new TextMessage("{\"type\":\"unsubscribe\",\"topic\":\"conversation:conv-1\"}"));

        transport.broadcast("conversation:conv-1", Map.of("type", "new_message"));
        transport.afterConnectionClosed(session, CloseStatus.NORMAL);
        transport.sendToUser("client-1", Map.of("type", "notification"));

        verify(session, times(1)).sendMessage(any());
    }

    @Test
    void handleTextMessage_shouldIgnoreMalformedFrames() throws Exception {
        WebSocketSession session = session("s1", "client-1");
        transport.afterConnectionEstablished(session);

        transport.handleTextMessage(session, new TextMessage("not json"));
        transport.handleTextMessage(session, new TextMessage("{\"type\":\"subscribe\"}"));

        verify(session, never()).sendMessage(any());
    }

    private static WebSocketSession session(String id, String userId) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.getUri()).thenReturn(URI.create("ws://localhost/ws?userId=" + userId));
        when(session.isOpen()).thenReturn(true);
        when(session.getAttributes()).thenReturn(new HashMap<>());
        return session;
    }

    private static String lastPayload(WebSocketSession session) throws IOException {
        @SuppressWarnings("unchecked")
        ArgumentCaptor<WebSocketMessage<?>> captor = ArgumentCaptor.forClass(WebSocketMessage.class);
        verify(session, atLeastOnce()).sendMessage(captor.capture());
        return ((TextMessage) captor.getValue()).getPayload();
    }
}
