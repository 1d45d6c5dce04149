package com.example.chatfunctions.model;

import lombok.Value;

/**
 * Bucket plus object path of a stored blob.
 */
@Value
public class ObjectRef {
    String bucket;
    String path;

    public String toGsUri() {
        return "gs://" + bucket + "/" + path;
    }

    @Override
    public String toString() {
        return toGsUri();
    }
}
