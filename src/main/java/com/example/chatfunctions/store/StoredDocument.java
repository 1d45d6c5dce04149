package com.example.chatfunctions.store;

import lombok.Value;

import java.util.Map;

@Value
public class StoredDocument {
    String id;
    Map<String, Object> fields;
}
