package com.example.chatfunctions.model;

import lombok.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A chat message as stored in the {@code messages} collection.
 * Either {@code text} or {@code imageUrl} is set by the posting client.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Message {
    private String id;
    private String name;
    private String text;
    private String imageUrl;
    private String storageUri;
    private String profilePicUrl;
    private boolean moderated;
    private Instant timestamp;

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    /**
     * Document fields for this message, without the id. Unset optional fields are left out.
     */
    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", name);
        if (text != null) fields.put("text", text);
        if (imageUrl != null) fields.put("imageUrl", imageUrl);
        if (storageUri != null) fields.put("storageUri", storageUri);
        if (profilePicUrl != null) fields.put("profilePicUrl", profilePicUrl);
        fields.put("moderated", moderated);
        if (timestamp != null) fields.put("timestamp", timestamp);
        return fields;
    }
}
