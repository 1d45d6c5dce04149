package com.example.chatfunctions.error;

/**
 * A managed service (document store, blob store, classifier, push dispatcher) failed or was unreachable.
 */
public class UpstreamServiceException extends RuntimeException {

    private final String service;

    public UpstreamServiceException(String service, String message, Throwable cause) {
        super(service + ": " + message, cause);
        this.service = service;
    }

    public UpstreamServiceException(String service, String message) {
        this(service, message, null);
    }

    public String getService() {
        return service;
    }
}
