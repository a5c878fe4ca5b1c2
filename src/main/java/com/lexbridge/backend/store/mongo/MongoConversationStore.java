package com.lexbridge.backend.store.mongo;

import com.lexbridge.backend.models.Conversation;
import com.lexbridge.backend.store.ConversationStore;
import com.mongodb.client.MongoDatabase;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
public class MongoConversationStore extends AbstractMongoStore implements ConversationStore {

    public MongoConversationStore(MongoDatabase mongoDatabase) {
        super(mongoDatabase, "conversations");
    }

    @Override
    public Conversation create(Conversation conversation) {
        Document doc = MongoDocuments.toDocument(conversation);
        insert(doc);
        return MongoDocuments.toConversation(doc);
    }

    @Override
    public Optional<Conversation> findById(String id) {
        ObjectId objectId = parseObjectId(id);
        if (objectId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(findFirst(byId(objectId))).map(MongoDocuments::toConversation);
    }

    @Override
    public List<Conversation> findByClientId(String clientId) {
        List<Conversation> result = new ArrayList<>();
        for (Document doc : findAll(new Document("clientId", clientId), new Document("updatedAt", -1), 0)) {
            result.add(MongoDocuments.toConversation(doc));
        }
        return result;
    }

    @Override
    public void update(Conversation conversation) {
        ObjectId objectId = parseObjectId(conversation.getId());
        if (objectId == null) {
            throw new IllegalArgumentException("Conversation id is not a valid ObjectId: " + conversation.getId());
        }
        replaceOne(byId(objectId), MongoDocuments.toDocument(conversation));
    }
}
