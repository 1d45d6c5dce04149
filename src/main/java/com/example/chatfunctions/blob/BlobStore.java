package com.example.chatfunctions.blob;

import com.example.chatfunctions.model.ObjectRef;

import java.nio.file.Path;
import java.util.Map;

public interface BlobStore {

    /** Downloads the object to {@code destination}, creating parent directories. */
    Path download(ObjectRef ref, Path destination);

    /**
     * Uploads {@code source} to {@code ref}, replacing any existing object. Returns the generation of the
     * written object, or null if the store does not report one.
     */
    Long upload(Path source, ObjectRef ref, String contentType, Map<String, String> metadata);
}
