package com.lexbridge.backend.store.mongo;

import com.lexbridge.backend.models.Message;
import com.lexbridge.backend.store.MessageStore;
import com.mongodb.client.MongoDatabase;
import jakarta.annotation.PostConstruct;
import org.bson.Document;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Component
public class MongoMessageStore extends AbstractMongoStore implements MessageStore {

    public MongoMessageStore(MongoDatabase mongoDatabase) {
        super(mongoDatabase, "messages");
    }

    @PostConstruct
    void ensureIndexes() {
        collection.createIndex(new Document("conversationId", 1).append("createdAt", 1));
    }

    @Override
    public Message append(Message message) {
        Document doc = MongoDocuments.toDocument(message);
        insert(doc);
        return MongoDocuments.toMessage(doc);
    }

    @Override
    public List<Message> findByConversationId(String conversationId) {
        return mapMessages(findAll(new Document("conversationId", conversationId), oldestFirst(), 0));
    }

    @Override
    public List<Message> findRecent(String conversationId, int limit) {
        Document newestFirst = new Document("createdAt", -1).append("_id", -1);
        List<Message> recent = mapMessages(findAll(new Document("conversationId", conversationId), newestFirst, limit));
        Collections.reverse(recent);
        return recent;
    }

    @Override
    public long countByConversationId(String conversationId) {
        return count(new Document("conversationId", conversationId));
    }

    // ObjectIds grow monotonically, so they break ties between messages stored in the same millisecond.
    private static Document oldestFirst() {
        return new Document("createdAt", 1).append("_id", 1);
    }

    private List<Message> mapMessages(List<Document> docs) {
        List<Message> result = new ArrayList<>();
        for (Document doc : docs) {
            result.add(MongoDocuments.toMessage(doc));
        }
        return result;
    }
}
