package com.example.chatfunctions.service;

import com.example.chatfunctions.kv.KvClient;
import com.example.chatfunctions.model.ObjectRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Remembers which object generations were written by the blur step, so the finalize event of our own
 * re-upload is not moderated again. Only this service writes the ledger; object metadata is set by
 * uploading clients and is never trusted for this.
 *
 * <p>When Redis is unavailable a re-upload is simply classified again.
 */
@Service
public class BlurredCopyLedger {

    private static final Logger logger = LoggerFactory.getLogger(BlurredCopyLedger.class);

    static final String KEY_PREFIX = "moderated:";

    private final KvClient kvClient;

    @Value("${app.moderation.ledger-ttl-seconds:86400}")
    private long ttlSeconds;

    public BlurredCopyLedger(KvClient kvClient) {
        this.kvClient = kvClient;
    }

    public void record(ObjectRef ref, Long generation) {
        if (generation == null) {
            logger.warn("No generation for blurred copy {}, its finalize event will be classified again", ref);
            return;
        }
        try {
            kvClient.setIfAbsent(key(ref, generation), "blurred", Duration.ofSeconds(ttlSeconds));
        } catch (RuntimeException e) {
            logger.warn("Could not record blurred copy {}#{}: {}", ref, generation, e.getMessage());
        }
    }

    public boolean isBlurredCopy(ObjectRef ref, Long generation) {
        if (generation == null) {
            return false;
        }
        try {
            return kvClient.exists(key(ref, generation));
        } catch (RuntimeException e) {
            logger.warn("Could not look up {}#{} in the blurred-copy ledger: {}", ref, generation, e.getMessage());
            return false;
        }
    }

    static String key(ObjectRef ref, long generation) {
        return KEY_PREFIX + ref.getBucket() + "/" + ref.getPath() + ":" + generation;
    }
}
