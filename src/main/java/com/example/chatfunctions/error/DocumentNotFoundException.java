package com.example.chatfunctions.error;

public class DocumentNotFoundException extends UpstreamServiceException {

    public DocumentNotFoundException(String collection, String id) {
        super("document-store", "no document " + collection + "/" + id);
    }
}
