package com.example.chatfunctions.model;

import lombok.Value;

/**
 * Outcome of delivering one notification to one device token.
 */
@Value
public class DeliveryResult {
    String token;
    boolean success;
    DeliveryErrorKind errorKind;
    String errorCode;
    String errorMessage;

    public static DeliveryResult delivered(String token) {
        return new DeliveryResult(token, true, null, null, null);
    }

    public static DeliveryResult failed(String token, DeliveryErrorKind kind, String code, String message) {
        return new DeliveryResult(token, false, kind, code, message);
    }
}
