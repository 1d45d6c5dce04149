package com.example.chatfunctions.event;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserCreatedEvent {
    private String eventId;
    private String uid;
    private String displayName;
}
