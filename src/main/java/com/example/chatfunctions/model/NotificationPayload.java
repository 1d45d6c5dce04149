package com.example.chatfunctions.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class NotificationPayload {
    static final int MAX_BODY_LENGTH = 100;
    static final String ELLIPSIS = "...";

    String title;
    String body;
    String icon;
    String clickAction;

    /**
     * Builds the notification announcing {@code message}. The body is the message text cut to
     * 100 characters (97 plus an ellipsis), or empty for an image-only message.
     */
    public static NotificationPayload forMessage(Message message, String defaultIcon, String clickAction) {
        boolean hasText = message.hasText();
        String title = message.getName() + " posted " + (hasText ? "a message" : "an image");
        String icon = message.getProfilePicUrl() != null && !message.getProfilePicUrl().isEmpty()
                ? message.getProfilePicUrl()
                : defaultIcon;
        return NotificationPayload.builder()
                .title(title)
                .body(hasText ? truncate(message.getText()) : "")
                .icon(icon)
                .clickAction(clickAction)
                .build();
    }

    static String truncate(String text) {
        if (text.length() <= MAX_BODY_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_BODY_LENGTH - ELLIPSIS.length()) + ELLIPSIS;
    }
}
