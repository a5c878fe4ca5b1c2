package com.lexbridge.backend.support;

import com.lexbridge.backend.assistant.AssistantAdapter;
import com.lexbridge.backend.config.LexBridgeProperties;
import com.lexbridge.backend.graph.CaseGraph;
import com.lexbridge.backend.models.AdvocateCapability;
import com.lexbridge.backend.service.AdvocateDirectory;
import com.lexbridge.backend.service.CaseLifecycleManager;
import com.lexbridge.backend.service.ConversationService;
import com.lexbridge.backend.service.KeyedLocks;
import com.lexbridge.backend.service.MatchingEngine;
import com.lexbridge.backend.service.NotificationGateway;
import com.lexbridge.backend.store.TransactionRunner;

import java.util.function.Supplier;

/**
 * The case core wired over in-memory stores.
 */
public class CaseCoreHarness {

    public final InMemoryAdvocateStore advocates = new InMemoryAdvocateStore();
    public final InMemoryCaseStore cases = new InMemoryCaseStore();
    public final InMemoryCaseRequestStore requests = new InMemoryCaseRequestStore();
    public final InMemoryConversationStore conversations = new InMemoryConversationStore();
    public final InMemoryMessageStore messages = new InMemoryMessageStore();
    public final InMemoryNotificationStore notifications = new InMemoryNotificationStore();
    public final RecordingTransport transport = new RecordingTransport();
    public final LexBridgeProperties properties = new LexBridgeProperties();

    public final TransactionRunner transactions = new TransactionRunner() {
        @Override
        public <T> T inTransaction(Supplier<T> work) {
            return work.get();
        }
    };

    public final AdvocateDirectory directory = new AdvocateDirectory(advocates);
    public final MatchingEngine engine = new MatchingEngine();
    public final NotificationGateway gateway = new NotificationGateway(notifications, transport);
    public final CaseLifecycleManager lifecycle;

    public CaseCoreHarness() {
        this(CaseGraph.NOOP);
    }

    public CaseCoreHarness(CaseGraph graph) {
        lifecycle = new CaseLifecycleManager(cases, requests, conversations, messages, directory, engine,
                transactions, new KeyedLocks(), gateway, graph, properties);
    }

    public ConversationService conversationService(AssistantAdapter assistant) {
        return new ConversationService(conversations, messages, lifecycle, assistant, gateway, transactions,
                new KeyedLocks(), properties);
    }

    public AdvocateCapability addAdvocate(AdvocateCapability advocate) {
        return advocates.create(advocate);
    }
}
