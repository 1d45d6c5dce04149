package com.example.chatfunctions.service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public class WelcomeResult implements InvocationResult {

    private final boolean success;
    private final String messageId;
    private final String text;
    private final String message;
    private final Instant timestamp;

    private WelcomeResult(boolean success, String messageId, String text, String message) {
        this.success = success;
        this.messageId = messageId;
        this.text = text;
        this.message = message;
        this.timestamp = Instant.now();
    }

    public static WelcomeResult written(String messageId, String text) {
        return new WelcomeResult(true, messageId, text, "Welcome message written to database");
    }

    public static WelcomeResult failed(String text, String message) {
        return new WelcomeResult(false, null, text, message);
    }

    @Override
    public boolean isSuccess() { return success; }
    public String getMessageId() { return messageId; }
    public String getText() { return text; }
    public String getMessage() { return message; }
    public Instant getTimestamp() { return timestamp; }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("success", success);
        if (messageId != null) map.put("messageId", messageId);
        map.put("text", text);
        map.put("message", message);
        map.put("timestamp", timestamp.toString());
        return map;
    }
}
