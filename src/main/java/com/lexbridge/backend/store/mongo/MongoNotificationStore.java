package com.lexbridge.backend.store.mongo;

import com.lexbridge.backend.models.Notification;
import com.lexbridge.backend.store.NotificationStore;
import com.mongodb.client.MongoDatabase;
import jakarta.annotation.PostConstruct;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class MongoNotificationStore extends AbstractMongoStore implements NotificationStore {

    public MongoNotificationStore(MongoDatabase mongoDatabase) {
        super(mongoDatabase, "notifications");
    }

    @PostConstruct
    void ensureIndexes() {
        collection.createIndex(new Document("recipientId", 1).append("read", 1).append("createdAt", -1));
    }

    @Override
    public Notification create(Notification notification) {
        Document doc = MongoDocuments.toDocument(notification);
        insert(doc);
        return MongoDocuments.toNotification(doc);
    }

    @Override
    public List<Notification> findByRecipient(String recipientId, boolean unreadOnly, int limit) {
        Document filter = new Document("recipientId", recipientId);
        if (unreadOnly) {
            filter.append("read", false);
        }
        List<Notification> result = new ArrayList<>();
        for (Document doc : findAll(filter, new Document("createdAt", -1), limit)) {
            result.add(MongoDocuments.toNotification(doc));
        }
        return result;
    }

    @Override
    public long countUnread(String recipientId) {
        return count(new Document("recipientId", recipientId).append("read", false));
    }

    @Override
    public boolean markRead(String id, String recipientId) {
        ObjectId objectId = parseObjectId(id);
        if (objectId == null) {
            return false;
        }
        return updateOne(byId(objectId).append("recipientId", recipientId),
                new Document("$set", new Document("read", true))).getMatchedCount() > 0;
    }

    @Override
    public long markAllRead(String recipientId) {
        return updateMany(new Document("recipientId", recipientId).append("read", false),
                new Document("$set", new Document("read", true))).getModifiedCount();
    }
}
