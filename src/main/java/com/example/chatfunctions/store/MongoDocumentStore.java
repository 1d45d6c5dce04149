package com.example.chatfunctions.store;

import com.example.chatfunctions.error.DocumentNotFoundException;
import com.example.chatfunctions.error.UpstreamServiceException;
import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;
import java.util.function.Supplier;
import java.util.stream.Collectors;

@Component
public class MongoDocumentStore implements DocumentStore {

    private static final String ID = "_id";
    private static final String SERVICE = "document-store";

    private final MongoTemplate mongo;

    @Autowired
    public MongoDocumentStore(MongoTemplate mongo) {
        this.mongo = mongo;
    }

    @Override
    public String add(String collection, Map<String, Object> fields) {
        String id = new ObjectId().toHexString();
        Document doc = new Document(resolvePlaceholders(fields));
        doc.put(ID, id);
        run("insert into " + collection, () -> mongo.insert(doc, collection));
        return id;
    }

    @Override
    public Optional<StoredDocument> get(String collection, String id) {
        Document doc = run("read " + collection + "/" + id, () -> mongo.findById(id, Document.class, collection));
        return Optional.ofNullable(doc).map(MongoDocumentStore::toStored);
    }

    @Override
    public void update(String collection, String id, Map<String, Object> fields) {
        Update update = new Update();
        resolvePlaceholders(fields).forEach(update::set);
        UpdateResult result = run("update " + collection + "/" + id,
                () -> mongo.updateFirst(byId(id), update, collection));
        if (result.getMatchedCount() == 0) {
            throw new DocumentNotFoundException(collection, id);
        }
    }

    @Override
    public void delete(String collection, String id) {
        run("delete " + collection + "/" + id, () -> mongo.remove(byId(id), collection));
    }

    @Override
    public List<StoredDocument> listAll(String collection) {
        List<Document> docs = run("list " + collection, () -> mongo.findAll(Document.class, collection));
        return docs.stream().map(MongoDocumentStore::toStored).collect(Collectors.toList());
    }

    private static Query byId(String id) {
        return Query.query(Criteria.where(ID).is(id));
    }

    private static StoredDocument toStored(Document doc) {
        Map<String, Object> fields = new LinkedHashMap<>(doc);
        Object id = fields.remove(ID);
        return new StoredDocument(Objects.toString(id, null), fields);
    }

    private static Map<String, Object> resolvePlaceholders(Map<String, Object> fields) {
        Date now = Date.from(Instant.now());
        Map<String, Object> resolved = new LinkedHashMap<>();
        fields.forEach((k, v) -> resolved.put(k, v == SERVER_TIMESTAMP ? now : v));
        return resolved;
    }

    private static <T> T run(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new UpstreamServiceException(SERVICE, operation + " failed", e);
        }
    }
}
