package com.example.chatfunctions.event;

import com.example.chatfunctions.model.Message;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MessageCreatedEvent {
    private String eventId;
    private String messageId;
    private Message message;
}
