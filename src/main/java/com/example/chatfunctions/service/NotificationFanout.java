package com.example.chatfunctions.service;

import com.example.chatfunctions.model.DeliveryResult;
import com.example.chatfunctions.model.DeviceToken;
import com.example.chatfunctions.model.Message;
import com.example.chatfunctions.model.NotificationPayload;
import com.example.chatfunctions.push.PushDispatcher;
import com.example.chatfunctions.store.DocumentStore;
import com.example.chatfunctions.store.StoredDocument;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Sends a push notification for each new message to every registered device and prunes the tokens
 * the dispatcher reports as invalid or unregistered.
 *
 * <p>All tokens are read in one unpaginated query. That is fine for a small chat room and will not
 * scale to large token collections.
 */
@Service
public class NotificationFanout {

    private static final Logger logger = LoggerFactory.getLogger(NotificationFanout.class);

    private final DocumentStore documentStore;
    private final PushDispatcher pushDispatcher;
    private final ExecutorService cleanupExecutor;

    @Value("${app.collections.tokens:fcmTokens}")
    private String tokensCollection;

    @Value("${app.notifications.default-icon:/images/profile_placeholder.png}")
    private String defaultIcon;

    @Value("${app.notifications.click-action:}")
    private String clickAction;

    public NotificationFanout(DocumentStore documentStore, PushDispatcher pushDispatcher,
                              @Value("${app.notifications.cleanup-threads:4}") int cleanupThreads) {
        this.documentStore = documentStore;
        this.pushDispatcher = pushDispatcher;
        this.cleanupExecutor = Executors.newFixedThreadPool(Math.max(cleanupThreads, 1), r -> {
            Thread t = new Thread(r, "token-cleanup-thread");
            t.setDaemon(true);
            return t;
        });
    }

    public FanoutResult notifyOnNewMessage(Message message) {
        String messageId = message.getId();
        NotificationPayload payload = NotificationPayload.forMessage(message, defaultIcon, clickAction);

        List<DeviceToken> tokens;
        try {
            tokens = loadTokens();
        } catch (RuntimeException e) {
            logger.error("Loading device tokens for message {} failed", messageId, e);
            return FanoutResult.failed(messageId, e.getMessage());
        }
        if (tokens.isEmpty()) {
            logger.info("No device tokens registered, nothing to send for message {}", messageId);
            return FanoutResult.noTokens(messageId);
        }

        List<String> tokenIds = tokens.stream().map(DeviceToken::getToken).collect(Collectors.toList());
        List<DeliveryResult> results;
        try {
            results = pushDispatcher.sendToMany(tokenIds, payload);
        } catch (RuntimeException e) {
            logger.error("Sending notifications for message {} failed", messageId, e);
            return FanoutResult.failed(messageId, e.getMessage());
        }

        long delivered = results.stream().filter(DeliveryResult::isSuccess).count();
        logger.info("Notifications for message {} sent: {}/{} delivered", messageId, delivered, tokenIds.size());

        List<String> pruned = cleanupTokens(results);
        return FanoutResult.dispatched(messageId, tokenIds.size(), (int) delivered, pruned);
    }

    private List<DeviceToken> loadTokens() {
        List<DeviceToken> tokens = new ArrayList<>();
        for (StoredDocument doc : documentStore.listAll(tokensCollection)) {
            tokens.add(new DeviceToken(doc.getId()));
        }
        return tokens;
    }

    /**
     * Deletes tokens reported as invalid or unregistered. Deletions run concurrently and are all awaited;
     * a failed deletion is logged and does not fail the invocation.
     */
    private List<String> cleanupTokens(List<DeliveryResult> results) {
        List<String> stale = new ArrayList<>();
        for (DeliveryResult result : results) {
            if (result.isSuccess()) {
                continue;
            }
            if (result.getErrorKind() != null && result.getErrorKind().isTokenGone()) {
                stale.add(result.getToken());
            } else {
                logger.warn("Failure sending notification to {}: {} {}",
                        result.getToken(), result.getErrorCode(), result.getErrorMessage());
            }
        }
        if (stale.isEmpty()) {
            return stale;
        }

        List<CompletableFuture<Void>> deletions = stale.stream()
                .map(token -> CompletableFuture
                        .runAsync(() -> documentStore.delete(tokensCollection, token), cleanupExecutor)
                        .whenComplete((ignored, error) -> {
                            if (error != null) {
                                logger.warn("Could not delete stale token {}", token, error);
                            } else {
                                logger.debug("Deleted stale token {}", token);
                            }
                        }))
                .collect(Collectors.toList());

        CompletableFuture.allOf(deletions.toArray(new CompletableFuture[0]))
                .handle((ignored, error) -> null)
                .join();
        logger.info("Pruned {} stale device tokens", stale.size());
        return stale;
    }

    @PreDestroy
    public void shutdown() {
        cleanupExecutor.shutdown();
    }
}
