package com.lexbridge.backend.store.mongo;

import com.lexbridge.backend.exception.ConflictException;
import com.lexbridge.backend.exception.ConflictReason;
import com.lexbridge.backend.models.CaseRequest;
import com.lexbridge.backend.models.RequestStatus;
import com.lexbridge.backend.store.CaseRequestStore;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.IndexOptions;
import jakarta.annotation.PostConstruct;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;

@Component
public class MongoCaseRequestStore extends AbstractMongoStore implements CaseRequestStore {

    static final String ONE_PENDING_PER_CASE = "one_pending_request_per_case";

    public MongoCaseRequestStore(MongoDatabase mongoDatabase) {
        super(mongoDatabase, "caseRequests");
    }

    @PostConstruct
    void ensureIndexes() {
        // At most one pending request per case, across processes.
        collection.createIndex(new Document("caseId", 1), new IndexOptions()
                .name(ONE_PENDING_PER_CASE)
                .unique(true)
                .partialFilterExpression(new Document("status", RequestStatus.PENDING.getValue())));
        collection.createIndex(new Document("advocateId", 1).append("createdAt", -1));
    }

    @Override
    public CaseRequest create(CaseRequest request) {
        Document doc = MongoDocuments.toDocument(request);
        try {
            insert(doc);
        } catch (MongoWriteException ex) {
            if (ErrorCategory.fromErrorCode(ex.getCode()) == ErrorCategory.DUPLICATE_KEY) {
                throw new ConflictException(ConflictReason.REQUEST_ALREADY_PENDING,
                        "There is already a pending request for this case");
            }
            throw ex;
        }
        return MongoDocuments.toCaseRequest(doc);
    }

    @Override
    public Optional<CaseRequest> findById(String id) {
        ObjectId objectId = parseObjectId(id);
        if (objectId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(findFirst(byId(objectId))).map(MongoDocuments::toCaseRequest);
    }

    @Override
    public List<CaseRequest> findByCaseId(String caseId) {
        return mapRequests(findAll(new Document("caseId", caseId), new Document("createdAt", 1).append("_id", 1), 0));
    }

    @Override
    public Optional<CaseRequest> findPendingByCaseId(String caseId) {
        Document filter = new Document("caseId", caseId).append("status", RequestStatus.PENDING.getValue());
        return Optional.ofNullable(findFirst(filter)).map(MongoDocuments::toCaseRequest);
    }

    @Override
    public List<CaseRequest> findByAdvocateId(String advocateId, RequestStatus status) {
        Document filter = new Document("advocateId", advocateId);
        if (status != null) {
            filter.append("status", status.getValue());
        }
        return mapRequests(findAll(filter, new Document("createdAt", -1), 0));
    }

    @Override
    public boolean resolve(String id, RequestStatus outcome, Instant respondedAt, String rejectionReason) {
        ObjectId objectId = parseObjectId(id);
        if (objectId == null) {
            return false;
        }
        Document filter = byId(objectId).append("status", RequestStatus.PENDING.getValue());
        Document set = new Document("status", outcome.getValue())
                .append("respondedAt", Date.from(respondedAt))
                .append("rejectionReason", rejectionReason);
        return updateOne(filter, new Document("$set", set)).getModifiedCount() > 0;
    }

    private List<CaseRequest> mapRequests(List<Document> docs) {
        List<CaseRequest> result = new ArrayList<>();
        for (Document doc : docs) {
            result.add(MongoDocuments.toCaseRequest(doc));
        }
        return result;
    }
}
