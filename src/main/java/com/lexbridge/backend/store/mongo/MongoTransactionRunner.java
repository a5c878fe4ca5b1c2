package com.lexbridge.backend.store.mongo;

import com.lexbridge.backend.store.TransactionRunner;
import com.mongodb.client.ClientSession;
import com.mongodb.client.MongoClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Multi-document transactions need a replica set or sharded cluster, and the
 * all-or-nothing guarantee of accept, reject and case creation rests on them.
 * {@code lexbridge.mongo.transactions=false} exists for a standalone
 * development server only: writes then run one by one, a failure part way
 * through can leave some of them applied, and concurrent accepts are held
 * apart only by the in-process case locks and the pending-request index.
 */
@Slf4j
@Component
public class MongoTransactionRunner implements TransactionRunner {

    private final MongoClient mongoClient;
    private final boolean transactionsEnabled;

    public MongoTransactionRunner(MongoClient mongoClient,
                                  @Value("${lexbridge.mongo.transactions:true}") boolean transactionsEnabled) {
        this.mongoClient = mongoClient;
        this.transactionsEnabled = transactionsEnabled;
        if (!transactionsEnabled) {
            log.warn("MongoDB transactions are disabled; accept, reject and case creation are NOT atomic. "
                    + "Use a replica set with lexbridge.mongo.transactions=true outside development");
        }
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        if (!transactionsEnabled || MongoSessionContext.current() != null) {
            return work.get();
        }
        try (ClientSession session = mongoClient.startSession()) {
            MongoSessionContext.bind(session);
            try {
                return session.withTransaction(work::get);
            } finally {
                MongoSessionContext.clear();
            }
        }
    }
}
