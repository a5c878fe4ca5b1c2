package com.lexbridge.backend.config;

import com.lexbridge.backend.graph.CaseGraph;
import com.lexbridge.backend.graph.Neo4jCaseGraph;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.ServerApi;
import com.mongodb.ServerApiVersion;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
public class DatabaseConfig {

    @Bean(destroyMethod = "close")
    public MongoClient mongoClient(@Value("${lexbridge.mongo.uri:mongodb://localhost:27017}") String mongoUri,
                                   @Value("${lexbridge.mongo.stable-api:true}") boolean stableApi) {
        ConnectionString connectionString = new ConnectionString(mongoUri);
        MongoClientSettings.Builder settingsBuilder = MongoClientSettings.builder()
                .applyConnectionString(connectionString);

        // Atlas clusters expect Stable API versioning
        if (stableApi) {
            settingsBuilder.serverApi(ServerApi.builder()
                    .version(ServerApiVersion.V1)
                    .build());
        }

        return MongoClients.create(settingsBuilder.build());
    }

    @Bean
    public MongoDatabase mongoDatabase(
            MongoClient mongoClient,
            @Value("${lexbridge.mongo.database:lexbridge}") String databaseName
    ) {
        return mongoClient.getDatabase(databaseName);
    }

    @Bean(destroyMethod = "close")
    public Driver neo4jDriver(
            @Value("${lexbridge.neo4j.uri:bolt://localhost:7687}") String neo4jUri,
            @Value("${lexbridge.neo4j.username:neo4j}") String username,
            @Value("${lexbridge.neo4j.password:password}") String password
    ) {
        String normalizedUri = neo4jUri;
        if (neo4jUri.contains("databases.neo4j.io")) {
            if (neo4jUri.startsWith("neo4j://")) {
                normalizedUri = neo4jUri.replace("neo4j://", "neo4j+s://");
            } else if (neo4jUri.startsWith("bolt://")) {
                normalizedUri = neo4jUri.replace("bolt://", "bolt+s://");
            }
        }

        Config config = Config.builder()
                .withConnectionTimeout(10, TimeUnit.SECONDS)
                .withConnectionAcquisitionTimeout(10, TimeUnit.SECONDS)
                .withMaxConnectionLifetime(10, TimeUnit.MINUTES)
                .withMaxConnectionPoolSize(20)
                .build();

        return GraphDatabase.driver(normalizedUri, AuthTokens.basic(username, password), config);
    }

    /** The driver connects lazily, so a disabled graph never opens a socket. */
    @Bean
    public CaseGraph caseGraph(Driver neo4jDriver, LexBridgeProperties properties) {
        if (!properties.getGraph().isEnabled()) {
            log.info("Case graph recording is disabled");
            return CaseGraph.NOOP;
        }
        return new Neo4jCaseGraph(neo4jDriver);
    }
}
