package com.lexbridge.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Threads that write to WebSocket sessions, kept apart from request threads so
 * a slow client never holds up the request that produced the event.
 */
@Configuration
public class RealtimeConfig {

    public static final String REALTIME_EXECUTOR = "realtimeExecutor";

    @Bean(name = REALTIME_EXECUTOR)
    public ThreadPoolTaskExecutor realtimeExecutor(LexBridgeProperties properties) {
        LexBridgeProperties.Realtime realtime = properties.getRealtime();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(realtime.getSenderPoolSize());
        executor.setMaxPoolSize(realtime.getSenderPoolSize());
        executor.setQueueCapacity(realtime.getSenderQueueCapacity());
        executor.setThreadNamePrefix("ws-send-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
