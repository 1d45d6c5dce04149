package com.example.chatfunctions.model;

import lombok.Value;

/**
 * A registered push token. The token string is the document key in the tokens collection.
 */
@Value
public class DeviceToken {
    String token;
}
