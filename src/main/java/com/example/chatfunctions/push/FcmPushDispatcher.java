package com.example.chatfunctions.push;

import com.example.chatfunctions.error.UpstreamServiceException;
import com.example.chatfunctions.model.DeliveryErrorKind;
import com.example.chatfunctions.model.DeliveryResult;
import com.example.chatfunctions.model.NotificationPayload;
import com.google.firebase.messaging.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class FcmPushDispatcher implements PushDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(FcmPushDispatcher.class);
    private static final String SERVICE = "push-dispatcher";

    /** FCM multicast limit. */
    static final int MAX_TOKENS_PER_BATCH = 500;

    static final String BATCH_FAILED = "BATCH_FAILED";

    private final FirebaseMessaging messaging;

    public FcmPushDispatcher(FirebaseMessaging messaging) {
        this.messaging = messaging;
    }

    /**
     * Sends in multicast batches. A batch whose request fails outright is reported as an {@code OTHER}
     * failure for each of its tokens so the results of the other batches are kept; only when every
     * batch fails is the whole send treated as an upstream failure.
     */
    @Override
    public List<DeliveryResult> sendToMany(List<String> tokens, NotificationPayload payload) {
        List<DeliveryResult> results = new ArrayList<>(tokens.size());
        int batches = 0;
        int failedBatches = 0;
        FirebaseMessagingException lastError = null;
        for (int from = 0; from < tokens.size(); from += MAX_TOKENS_PER_BATCH) {
            List<String> batch = tokens.subList(from, Math.min(from + MAX_TOKENS_PER_BATCH, tokens.size()));
            batches++;
            BatchResponse response;
            try {
                response = messaging.sendEachForMulticast(buildMessage(batch, payload));
            } catch (FirebaseMessagingException e) {
                failedBatches++;
                lastError = e;
                logger.warn("Multicast batch of {} tokens starting at {} failed: {}", batch.size(), from, e.getMessage());
                for (String token : batch) {
                    results.add(DeliveryResult.failed(token, DeliveryErrorKind.OTHER, BATCH_FAILED, e.getMessage()));
                }
                continue;
            }
            logger.debug("Multicast batch: {} delivered, {} failed", response.getSuccessCount(), response.getFailureCount());

            List<SendResponse> responses = response.getResponses();
            for (int i = 0; i < batch.size(); i++) {
                results.add(toResult(batch.get(i), responses.get(i)));
            }
        }
        if (batches > 0 && failedBatches == batches) {
            throw new UpstreamServiceException(SERVICE, "multicast to " + tokens.size() + " tokens failed", lastError);
        }
        return results;
    }

    static MulticastMessage buildMessage(List<String> tokens, NotificationPayload payload) {
        WebpushConfig.Builder webpush = WebpushConfig.builder()
                .setNotification(WebpushNotification.builder()
                        .setTitle(payload.getTitle())
                        .setBody(payload.getBody())
                        .setIcon(payload.getIcon())
                        .build());
        if (payload.getClickAction() != null && !payload.getClickAction().isEmpty()) {
            webpush.setFcmOptions(WebpushFcmOptions.withLink(payload.getClickAction()));
        }
        return MulticastMessage.builder()
                .setNotification(Notification.builder()
                        .setTitle(payload.getTitle())
                        .setBody(payload.getBody())
                        .build())
                .setWebpushConfig(webpush.build())
                .addAllTokens(tokens)
                .build();
    }

    private static DeliveryResult toResult(String token, SendResponse response) {
        if (response.isSuccessful()) {
            return DeliveryResult.delivered(token);
        }
        FirebaseMessagingException error = response.getException();
        MessagingErrorCode code = error == null ? null : error.getMessagingErrorCode();
        return DeliveryResult.failed(token, errorKind(code),
                code == null ? "UNKNOWN" : code.name(),
                error == null ? null : error.getMessage());
    }

    static DeliveryErrorKind errorKind(MessagingErrorCode code) {
        if (code == null) {
            return DeliveryErrorKind.OTHER;
        }
        switch (code) {
            case UNREGISTERED:
                return DeliveryErrorKind.NOT_REGISTERED;
            case INVALID_ARGUMENT:
                return DeliveryErrorKind.INVALID_TOKEN;
            default:
                return DeliveryErrorKind.OTHER;
        }
    }
}
