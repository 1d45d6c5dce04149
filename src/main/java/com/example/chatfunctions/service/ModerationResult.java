package com.example.chatfunctions.service;

import com.example.chatfunctions.model.SafeSearchVerdict;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public class ModerationResult implements InvocationResult {

    public enum Outcome {
        /** Classified safe, nothing changed. */
        CLEAN,
        BLURRED,
        /** Not a candidate for moderation (our own blurred re-upload, or not an image). */
        SKIPPED,
        FAILED
    }

    public enum Stage {
        DECODE_PATH,
        CLASSIFY,
        DOWNLOAD,
        TRANSFORM,
        UPLOAD,
        MARK_MODERATED
    }

    private final Outcome outcome;
    private final String path;
    private final String messageId;
    private final SafeSearchVerdict verdict;
    private final Stage failedStage;
    private final String message;
    private final Instant timestamp;

    private ModerationResult(Outcome outcome, String path, String messageId, SafeSearchVerdict verdict,
                             Stage failedStage, String message) {
        this.outcome = outcome;
        this.path = path;
        this.messageId = messageId;
        this.verdict = verdict;
        this.failedStage = failedStage;
        this.message = message;
        this.timestamp = Instant.now();
    }

    public static ModerationResult clean(String path, String messageId, SafeSearchVerdict verdict) {
        return new ModerationResult(Outcome.CLEAN, path, messageId, verdict, null, "Image detected as OK");
    }

    public static ModerationResult blurred(String path, String messageId, SafeSearchVerdict verdict) {
        return new ModerationResult(Outcome.BLURRED, path, messageId, verdict, null,
                "Image blurred and message marked as moderated");
    }

    public static ModerationResult skipped(String path, String reason) {
        return new ModerationResult(Outcome.SKIPPED, path, null, null, null, reason);
    }

    public static ModerationResult failed(String path, String messageId, SafeSearchVerdict verdict,
                                          Stage stage, String message) {
        return new ModerationResult(Outcome.FAILED, path, messageId, verdict, stage, message);
    }

    @Override
    public boolean isSuccess() {
        return outcome != Outcome.FAILED;
    }

    @Override
    public boolean isMalformedInput() {
        return failedStage == Stage.DECODE_PATH;
    }

    /**
     * The blurred image replaced the original but the message was not marked. No compensation is attempted.
     */
    public boolean isPartialCommit() {
        return failedStage == Stage.MARK_MODERATED;
    }

    public Outcome getOutcome() { return outcome; }
    public String getPath() { return path; }
    public String getMessageId() { return messageId; }
    public SafeSearchVerdict getVerdict() { return verdict; }
    public Stage getFailedStage() { return failedStage; }
    public String getMessage() { return message; }
    public Instant getTimestamp() { return timestamp; }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("success", isSuccess());
        map.put("outcome", outcome.name());
        map.put("path", path);
        if (messageId != null) map.put("messageId", messageId);
        if (verdict != null) {
            map.put("adult", verdict.getAdult().name());
            map.put("violence", verdict.getViolence().name());
        }
        if (failedStage != null) {
            map.put("failedStage", failedStage.name());
            map.put("partialCommit", isPartialCommit());
        }
        map.put("message", message);
        map.put("timestamp", timestamp.toString());
        return map;
    }
}
