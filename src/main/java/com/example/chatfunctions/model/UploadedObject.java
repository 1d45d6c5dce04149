package com.example.chatfunctions.model;

import lombok.*;

import java.util.Map;

/**
 * A finalized blob as described by the storage event.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UploadedObject {
    public static final String BLURRED_METADATA_KEY = "blurred";

    private String bucket;
    private String name;
    private String contentType;
    /** Storage generation of this object version; null when the event does not carry it. */
    private Long generation;
    private Map<String, String> metadata;

    public ObjectRef toRef() {
        return new ObjectRef(bucket, name);
    }

    public boolean isImage() {
        return contentType == null || contentType.startsWith("image/");
    }
}
