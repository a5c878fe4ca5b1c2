package com.lexbridge.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tunables for matching, the assistant, realtime delivery and startup seeding.
 * Connection settings for MongoDB and Neo4j are read directly in {@link DatabaseConfig}.
 */
@Component
@ConfigurationProperties(prefix = "lexbridge")
@Data
public class LexBridgeProperties {

    private Matching matching = new Matching();
    private Assistant assistant = new Assistant();
    private Realtime realtime = new Realtime();
    private Directory directory = new Directory();
    private Graph graph = new Graph();

    @Data
    public static class Matching {
        private int defaultLimit = 5;
    }

    @Data
    public static class Assistant {
        private String apiKey;
        private String modelName = "claude-sonnet-4-20250514";
        private int maxTokens = 4096;
        private Duration timeout = Duration.ofSeconds(60);
        private int historyWindow = 20;
    }

    @Data
    public static class Realtime {
        private int sendTimeLimitMillis = 5000;
        private int bufferSizeLimitBytes = 512 * 1024;
        private int senderPoolSize = 4;
        private int senderQueueCapacity = 10_000;
    }

    @Data
    public static class Directory {
        private boolean seed = false;
        private String seedLocation = "classpath:seed/advocates.json";
    }

    @Data
    public static class Graph {
        private boolean enabled = false;
    }
}
