package com.example.chatfunctions.controller;

import com.example.chatfunctions.kv.KvClient;
import com.example.chatfunctions.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports whether the backends the event handlers depend on answer.
 *
 * <p>MongoDB holds the messages and device tokens, so it being down makes the service DOWN (503).
 * Redis only backs event de-duplication and the blurred-copy ledger, both of which fail open, so
 * losing it only makes the service DEGRADED.
 */
@RestController
public class HealthController {

    private static final Logger logger = LoggerFactory.getLogger(HealthController.class);

    /** Looked up, never written: any answer, hit or miss, means the backend is reachable. */
    static final String HEALTH_KEY = "health:chat-functions";
    static final String HEALTH_DOCUMENT_ID = "_health";

    private final KvClient kvClient;
    private final DocumentStore documentStore;

    @Value("${spring.application.name:chat-functions}")
    private String serviceName;

    @Value("${app.collections.messages:messages}")
    private String messagesCollection;

    @Value("${app.collections.tokens:fcmTokens}")
    private String tokensCollection;

    public HealthController(KvClient kvClient, DocumentStore documentStore) {
        this.kvClient = kvClient;
        this.documentStore = documentStore;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("service", serviceName);

        boolean redisUp = check("redis", () -> kvClient.exists(HEALTH_KEY), health);
        boolean mongoUp = check("mongodb", () -> {
            documentStore.get(messagesCollection, HEALTH_DOCUMENT_ID);
            documentStore.get(tokensCollection, HEALTH_DOCUMENT_ID);
        }, health);

        if (!mongoUp) {
            health.put("status", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(health);
        }
        health.put("status", redisUp ? "UP" : "DEGRADED");
        return ResponseEntity.ok(health);
    }

    private static boolean check(String backend, Runnable lookup, Map<String, Object> health) {
        try {
            lookup.run();
            health.put(backend, "UP");
            return true;
        } catch (RuntimeException e) {
            logger.warn("Health check for {} failed: {}", backend, e.getMessage());
            health.put(backend, "DOWN");
            health.put(backend + "Error", String.valueOf(e.getMessage()));
            return false;
        }
    }
}
