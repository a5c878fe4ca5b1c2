package com.lexbridge.backend.store.mongo;

import com.lexbridge.backend.models.Case;
import com.lexbridge.backend.models.CaseStatus;
import com.lexbridge.backend.store.CaseStore;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.IndexOptions;
import jakarta.annotation.PostConstruct;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
public class MongoCaseStore extends AbstractMongoStore implements CaseStore {

    public MongoCaseStore(MongoDatabase mongoDatabase) {
        super(mongoDatabase, "cases");
    }

    @PostConstruct
    void ensureIndexes() {
        collection.createIndex(new Document("clientId", 1).append("createdAt", -1));
        collection.createIndex(new Document("advocateId", 1));
        collection.createIndex(new Document("conversationId", 1), new IndexOptions().sparse(true));
    }

    @Override
    public Case create(Case legalCase) {
        Document doc = MongoDocuments.toDocument(legalCase);
        insert(doc);
        return MongoDocuments.toCase(doc);
    }

    @Override
    public Optional<Case> findById(String id) {
        ObjectId objectId = parseObjectId(id);
        if (objectId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(findFirst(byId(objectId))).map(MongoDocuments::toCase);
    }

    @Override
    public Optional<Case> findByConversationId(String conversationId) {
        if (conversationId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(findFirst(new Document("conversationId", conversationId)))
                .map(MongoDocuments::toCase);
    }

    @Override
    public List<Case> findByClientId(String clientId) {
        return mapCases(findAll(new Document("clientId", clientId), new Document("createdAt", -1), 0));
    }

    @Override
    public List<Case> findByAdvocateId(String advocateId) {
        return mapCases(findAll(new Document("advocateId", advocateId), new Document("updatedAt", -1), 0));
    }

    @Override
    public boolean replaceIfStatus(Case legalCase, CaseStatus expectedStatus) {
        ObjectId objectId = parseObjectId(legalCase.getId());
        if (objectId == null) {
            return false;
        }
        Document filter = byId(objectId).append("status", expectedStatus.getValue());
        return replaceOne(filter, MongoDocuments.toDocument(legalCase)).getMatchedCount() > 0;
    }

    private List<Case> mapCases(List<Document> docs) {
        List<Case> result = new ArrayList<>();
        for (Document doc : docs) {
            result.add(MongoDocuments.toCase(doc));
        }
        return result;
    }
}
