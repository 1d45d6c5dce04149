package com.example.chatfunctions.service;

import com.example.chatfunctions.error.MalformedObjectReferenceException;
import lombok.Value;

/**
 * Decoded image object path. Clients upload message images to
 * {@code <owner>/<messageId>/<fileName>}, so the second segment names the owning message.
 */
@Value
public class MessageImagePath {
    String path;
    String messageId;
    String fileName;

    public static MessageImagePath decode(String path) {
        if (path == null || path.isBlank()) {
            throw new MalformedObjectReferenceException(String.valueOf(path), "empty path");
        }
        String[] segments = path.split("/", -1);
        if (segments.length < 3) {
            throw new MalformedObjectReferenceException(path, "expected <owner>/<messageId>/<fileName>");
        }
        for (String segment : segments) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                throw new MalformedObjectReferenceException(path, "empty or relative path segment");
            }
        }
        return new MessageImagePath(path, segments[1], segments[segments.length - 1]);
    }
}
