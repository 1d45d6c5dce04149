package com.example.chatfunctions.push;

import com.example.chatfunctions.model.DeliveryResult;
import com.example.chatfunctions.model.NotificationPayload;

import java.util.List;

public interface PushDispatcher {

    /**
     * Sends {@code payload} to every token. Returns one result per token, in the order of {@code tokens}.
     */
    List<DeliveryResult> sendToMany(List<String> tokens, NotificationPayload payload);
}
