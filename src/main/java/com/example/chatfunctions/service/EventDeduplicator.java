package com.example.chatfunctions.service;

import com.example.chatfunctions.kv.KvClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Claims event ids in Redis so that a redelivered event is acknowledged without running its handler
 * twice. A failed invocation releases its claim so a platform retry can run it again.
 *
 * <p>If Redis cannot be reached the event is processed anyway.
 */
@Service
public class EventDeduplicator {

    private static final Logger logger = LoggerFactory.getLogger(EventDeduplicator.class);

    static final String KEY_PREFIX = "event:";

    private final KvClient kvClient;

    @Value("${app.events.dedup-ttl-seconds:86400}")
    private long ttlSeconds;

    public EventDeduplicator(KvClient kvClient) {
        this.kvClient = kvClient;
    }

    /**
     * Returns true if the caller should process the event: it has no id, it was not seen before, or
     * Redis is unavailable.
     */
    public boolean claim(String eventId, String trigger) {
        if (eventId == null || eventId.isBlank()) {
            return true;
        }
        try {
            boolean claimed = kvClient.setIfAbsent(key(eventId), trigger, Duration.ofSeconds(ttlSeconds));
            if (!claimed) {
                logger.info("Event {} ({}) already handled, skipping redelivery", eventId, trigger);
            }
            return claimed;
        } catch (RuntimeException e) {
            logger.warn("Could not claim event {} ({}), processing without de-duplication: {}",
                    eventId, trigger, e.getMessage());
            return true;
        }
    }

    public void release(String eventId) {
        if (eventId == null || eventId.isBlank()) {
            return;
        }
        try {
            kvClient.del(key(eventId));
        } catch (RuntimeException e) {
            logger.warn("Could not release claim on event {}: {}", eventId, e.getMessage());
        }
    }

    private static String key(String eventId) {
        return KEY_PREFIX + eventId;
    }
}
