package com.lexbridge.backend.store.mongo;

import com.lexbridge.backend.exception.ConflictException;
import com.lexbridge.backend.exception.ConflictReason;
import com.lexbridge.backend.models.AdvocateCapability;
import com.lexbridge.backend.store.AdvocateStore;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.IndexOptions;
import jakarta.annotation.PostConstruct;
import org.bson.Document;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;

@Component
public class MongoAdvocateStore extends AbstractMongoStore implements AdvocateStore {

    public MongoAdvocateStore(MongoDatabase mongoDatabase) {
        super(mongoDatabase, "advocates");
    }

    @PostConstruct
    void ensureIndexes() {
        collection.createIndex(new Document("enrollmentNumber", 1), new IndexOptions()
                .unique(true)
                .partialFilterExpression(new Document("enrollmentNumber", new Document("$type", "string"))));
    }

    @Override
    public AdvocateCapability create(AdvocateCapability advocate) {
        Document doc = MongoDocuments.toDocument(advocate);
        if (advocate.getId() != null) {
            doc.append("_id", idValue(advocate.getId()));
        }
        try {
            insert(doc);
        } catch (MongoWriteException ex) {
            if (ErrorCategory.fromErrorCode(ex.getCode()) == ErrorCategory.DUPLICATE_KEY) {
                throw new ConflictException(ConflictReason.ENROLLMENT_NUMBER_TAKEN,
                        "Advocate profile or enrollment number already registered");
            }
            throw ex;
        }
        return MongoDocuments.toAdvocate(doc);
    }

    @Override
    public Optional<AdvocateCapability> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(findFirst(byId(idValue(id)))).map(MongoDocuments::toAdvocate);
    }

    @Override
    public Optional<AdvocateCapability> findByEnrollmentNumber(String enrollmentNumber) {
        if (enrollmentNumber == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(findFirst(new Document("enrollmentNumber", enrollmentNumber)))
                .map(MongoDocuments::toAdvocate);
    }

    @Override
    public List<AdvocateCapability> findAll() {
        List<AdvocateCapability> result = new ArrayList<>();
        for (Document doc : findAll(new Document(), new Document("_id", 1), 0)) {
            result.add(MongoDocuments.toAdvocate(doc));
        }
        return result;
    }

    @Override
    public long count() {
        return count(new Document());
    }

    @Override
    public AdvocateCapability updateProfile(AdvocateCapability advocate) {
        if (advocate.getId() == null) {
            throw new IllegalArgumentException("Advocate id is required for a profile update");
        }
        Document filter = byId(idValue(advocate.getId()));
        updateOne(filter, new Document("$set", MongoDocuments.advocateProfileFields(advocate)));
        return MongoDocuments.toAdvocate(findFirst(filter));
    }

    @Override
    public boolean incrementCaseLoad(String id) {
        if (id == null) {
            return false;
        }
        return updateOne(byId(idValue(id)),
                new Document("$inc", new Document("currentCaseLoad", 1))
                        .append("$set", new Document("updatedAt", Date.from(Instant.now()))))
                .getMatchedCount() > 0;
    }
}
