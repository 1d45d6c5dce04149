package com.example.chatfunctions.store;

import com.example.chatfunctions.error.DocumentNotFoundException;
import com.example.chatfunctions.error.UpstreamServiceException;
import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MongoDocumentStoreTest {

    @Mock
    private MongoTemplate mongo;

    private MongoDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new MongoDocumentStore(mongo);
    }

    @Test
    void testAdd_GeneratesIdAndResolvesTimestamp() {
        // Given
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("text", "hi");
        fields.put("timestamp", DocumentStore.SERVER_TIMESTAMP);

        // When
        String id = store.add("messages", fields);

        // Then
        ArgumentCaptor<Document> captor = ArgumentCaptor.forClass(Document.class);
        verify(mongo).insert(captor.capture(), eq("messages"));
        Document inserted = captor.getValue();
        assertEquals(id, inserted.get("_id"));
        assertEquals(24, id.length());
        assertEquals("hi", inserted.get("text"));
        assertInstanceOf(Date.class, inserted.get("timestamp"));
    }

    @Test
    void testGet_StripsId() {
        // Given
        Document doc = new Document("_id", "m1").append("text", "hello");
        when(mongo.findById("m1", Document.class, "messages")).thenReturn(doc);
        when(mongo.findById("missing", Document.class, "messages")).thenReturn(null);

        // When
        Optional<StoredDocument> found = store.get("messages", "m1");

        // Then
        assertTrue(found.isPresent());
        assertEquals("m1", found.get().getId());
        assertEquals(Map.of("text", "hello"), found.get().getFields());
        assertTrue(store.get("messages", "missing").isEmpty());
    }

    @Test
    void testUpdate_MissingDocument() {
        // Given
        when(mongo.updateFirst(any(Query.class), any(Update.class), eq("messages")))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        // When / Then
        assertThrows(DocumentNotFoundException.class,
                () -> store.update("messages", "nope", Map.of("moderated", true)));
    }

    @Test
    void testUpdate_ExistingDocument() {
        // Given
        when(mongo.updateFirst(any(Query.class), any(Update.class), eq("messages")))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        // When
        store.update("messages", "msg123", Map.of("moderated", true));

        // Then
        ArgumentCaptor<Update> captor = ArgumentCaptor.forClass(Update.class);
        verify(mongo).updateFirst(any(Query.class), captor.capture(), eq("messages"));
        assertEquals(new Document("moderated", true), captor.getValue().getUpdateObject().get("$set"));
    }

    @Test
    void testListAll_ReturnsEveryDocument() {
        // Given
        when(mongo.findAll(Document.class, "fcmTokens"))
                .thenReturn(List.of(new Document("_id", "tokA"), new Document("_id", "tokB")));

        // When
        List<StoredDocument> docs = store.listAll("fcmTokens");

        // Then
        assertEquals(List.of("tokA", "tokB"), docs.stream().map(StoredDocument::getId).toList());
    }

    @Test
    void testDelete_ById() {
        // When
        store.delete("fcmTokens", "tokA");

        // Then
        verify(mongo).remove(any(Query.class), eq("fcmTokens"));
    }

    @Test
    void testListAll_DriverErrorIsUpstreamFailure() {
        // Given
        when(mongo.findAll(Document.class, "fcmTokens")).thenThrow(new DataAccessResourceFailureException("down"));

        // When / Then
        UpstreamServiceException e = assertThrows(UpstreamServiceException.class, () -> store.listAll("fcmTokens"));
        assertEquals("document-store", e.getService());
    }
}
