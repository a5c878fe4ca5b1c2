package com.lexbridge.backend.config;

import com.lexbridge.backend.realtime.WebSocketTransport;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final WebSocketTransport webSocketTransport;
    private final String[] allowedOrigins;

    public WebSocketConfig(WebSocketTransport webSocketTransport,
                           @Value("${lexbridge.cors.allowed-origins:*}") String[] allowedOrigins) {
        this.webSocketTransport = webSocketTransport;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(webSocketTransport, "/ws").setAllowedOriginPatterns(allowedOrigins);
    }
}
