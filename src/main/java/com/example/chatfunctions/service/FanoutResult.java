package com.example.chatfunctions.service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class FanoutResult implements InvocationResult {

    public enum Outcome {
        NO_TOKENS,
        DISPATCHED,
        FAILED
    }

    private final Outcome outcome;
    private final String messageId;
    private final int tokenCount;
    private final int deliveredCount;
    private final List<String> prunedTokens;
    private final String message;
    private final Instant timestamp;

    private FanoutResult(Outcome outcome, String messageId, int tokenCount, int deliveredCount,
                         List<String> prunedTokens, String message) {
        this.outcome = outcome;
        this.messageId = messageId;
        this.tokenCount = tokenCount;
        this.deliveredCount = deliveredCount;
        this.prunedTokens = List.copyOf(prunedTokens);
        this.message = message;
        this.timestamp = Instant.now();
    }

    public static FanoutResult noTokens(String messageId) {
        return new FanoutResult(Outcome.NO_TOKENS, messageId, 0, 0, List.of(), "No registered device tokens");
    }

    public static FanoutResult dispatched(String messageId, int tokenCount, int deliveredCount, List<String> prunedTokens) {
        return new FanoutResult(Outcome.DISPATCHED, messageId, tokenCount, deliveredCount, prunedTokens,
                "Notifications sent to " + deliveredCount + "/" + tokenCount + " devices");
    }

    public static FanoutResult failed(String messageId, String message) {
        return new FanoutResult(Outcome.FAILED, messageId, 0, 0, List.of(), message);
    }

    @Override
    public boolean isSuccess() {
        return outcome != Outcome.FAILED;
    }

    public Outcome getOutcome() { return outcome; }
    public String getMessageId() { return messageId; }
    public int getTokenCount() { return tokenCount; }
    public int getDeliveredCount() { return deliveredCount; }
    /** Tokens selected for deletion because the dispatcher reported them gone. */
    public List<String> getPrunedTokens() { return prunedTokens; }
    public String getMessage() { return message; }
    public Instant getTimestamp() { return timestamp; }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("success", isSuccess());
        map.put("outcome", outcome.name());
        map.put("messageId", messageId);
        map.put("tokenCount", tokenCount);
        map.put("deliveredCount", deliveredCount);
        map.put("prunedTokens", prunedTokens);
        map.put("message", message);
        map.put("timestamp", timestamp.toString());
        return map;
    }
}
