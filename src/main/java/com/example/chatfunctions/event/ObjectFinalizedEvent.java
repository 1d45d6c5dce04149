package com.example.chatfunctions.event;

import com.example.chatfunctions.model.UploadedObject;
import lombok.*;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ObjectFinalizedEvent {
    private String eventId;
    private String bucket;
    private String name;
    private String contentType;
    private Long generation;
    private Map<String, String> metadata;

    public UploadedObject toUploadedObject() {
        return UploadedObject.builder()
                .bucket(bucket)
                .name(name)
                .contentType(contentType)
                .generation(generation)
                .metadata(metadata)
                .build();
    }
}
