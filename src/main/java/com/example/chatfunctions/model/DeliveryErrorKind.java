package com.example.chatfunctions.model;

public enum DeliveryErrorKind {
    INVALID_TOKEN,
    NOT_REGISTERED,
    OTHER;

    /** Errors that mean the token will never be deliverable again. */
    public boolean isTokenGone() {
        return this == INVALID_TOKEN || this == NOT_REGISTERED;
    }
}
