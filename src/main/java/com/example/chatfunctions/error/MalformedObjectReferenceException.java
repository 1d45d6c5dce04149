package com.example.chatfunctions.error;

public class MalformedObjectReferenceException extends IllegalArgumentException {

    public MalformedObjectReferenceException(String path, String reason) {
        super("Malformed object path '" + path + "': " + reason);
    }
}
