package com.lexbridge.backend.store.mongo;

import com.mongodb.client.ClientSession;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared plumbing for the hand-mapped collections. Every read and write joins
 * the transaction bound to the current thread, if any.
 */
public abstract class AbstractMongoStore {

    protected final MongoCollection<Document> collection;

    protected AbstractMongoStore(MongoDatabase mongoDatabase, String collectionName) {
        this.collection = mongoDatabase.getCollection(collectionName);
    }

    /** Null for ids that are not ObjectIds; such ids can never match a document. */
    protected static ObjectId parseObjectId(String id) {
        if (id == null || !ObjectId.isValid(id)) {
            return null;
        }
        return new ObjectId(id);
    }

    /**
     * The stored form of an id chosen by the caller: an ObjectId when the text
     * is one, the plain string otherwise.
     */
    protected static Object idValue(String id) {
        return ObjectId.isValid(id) ? new ObjectId(id) : id;
    }

    protected static Document byId(Object id) {
        return new Document("_id", id);
    }

    protected void insert(Document doc) {
        ClientSession session = MongoSessionContext.current();
        if (session != null) {
            collection.insertOne(session, doc);
        } else {
            collection.insertOne(doc);
        }
    }

    protected UpdateResult updateOne(Bson filter, Bson update) {
        ClientSession session = MongoSessionContext.current();
        return session != null
                ? collection.updateOne(session, filter, update)
                : collection.updateOne(filter, update);
    }

    protected UpdateResult updateMany(Bson filter, Bson update) {
        ClientSession session = MongoSessionContext.current();
        return session != null
                ? collection.updateMany(session, filter, update)
                : collection.updateMany(filter, update);
    }

    protected UpdateResult replaceOne(Bson filter, Document replacement) {
        ClientSession session = MongoSessionContext.current();
        return session != null
                ? collection.replaceOne(session, filter, replacement)
                : collection.replaceOne(filter, replacement);
    }

    protected FindIterable<Document> find(Bson filter) {
        ClientSession session = MongoSessionContext.current();
        return session != null ? collection.find(session, filter) : collection.find(filter);
    }

    protected Document findFirst(Bson filter) {
        return find(filter).first();
    }

    protected List<Document> findAll(Bson filter, Bson sort, int limit) {
        FindIterable<Document> cursor = find(filter);
        if (sort != null) {
            cursor = cursor.sort(sort);
        }
        if (limit > 0) {
            cursor = cursor.limit(limit);
        }
        return cursor.into(new ArrayList<>());
    }

    protected long count(Bson filter) {
        ClientSession session = MongoSessionContext.current();
        return session != null
                ? collection.countDocuments(session, filter)
                : collection.countDocuments(filter);
    }
}
