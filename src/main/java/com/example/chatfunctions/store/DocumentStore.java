package com.example.chatfunctions.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface DocumentStore {

    /** Field value replaced by the store's write time. */
    Object SERVER_TIMESTAMP = new Object() {
        @Override
        public String toString() {
            return "SERVER_TIMESTAMP";
        }
    };

    /** Inserts a new document with a generated id and returns the id. */
    String add(String collection, Map<String, Object> fields);

    Optional<StoredDocument> get(String collection, String id);

    /** Sets the given fields on an existing document; fails if the document does not exist. */
    void update(String collection, String id, Map<String, Object> fields);

    /** Removes a document; deleting a missing document is not an error. */
    void delete(String collection, String id);

    /** Reads the whole collection, unpaginated. */
    List<StoredDocument> listAll(String collection);
}
