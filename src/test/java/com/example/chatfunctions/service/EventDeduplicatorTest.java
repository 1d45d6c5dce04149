package com.example.chatfunctions.service;

import com.example.chatfunctions.kv.KvClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EventDeduplicatorTest {

    @Mock
    private KvClient kvClient;

    private EventDeduplicator deduplicator;

    @BeforeEach
    void setUp() {
        deduplicator = new EventDeduplicator(kvClient);
        ReflectionTestUtils.setField(deduplicator, "ttlSeconds", 600L);
    }

    @Test
    void testClaim_FirstDelivery() {
        // Given
        when(kvClient.setIfAbsent("event:e1", "sendNotifications", Duration.ofSeconds(600))).thenReturn(true);

        // When / Then
        assertTrue(deduplicator.claim("e1", "sendNotifications"));
    }

    @Test
    void testClaim_Redelivery() {
        // Given
        when(kvClient.setIfAbsent(eq("event:e1"), anyString(), any())).thenReturn(false);

        // When / Then
        assertFalse(deduplicator.claim("e1", "sendNotifications"));
    }

    @Test
    void testClaim_EventWithoutId() {
        // When / Then
        assertTrue(deduplicator.claim(null, "addWelcomeMessages"));
        assertTrue(deduplicator.claim(" ", "addWelcomeMessages"));
        verifyNoInteractions(kvClient);
    }

    @Test
    void testClaim_RedisOutageFailsOpen() {
        // Given
        when(kvClient.setIfAbsent(anyString(), anyString(), any())).thenThrow(new IllegalStateException("connection refused"));

        // When / Then
        assertTrue(deduplicator.claim("e2", "blurOffensiveImages"));
    }

    @Test
    void testRelease_DeletesClaim() {
        // When
        deduplicator.release("e3");

        // Then
        verify(kvClient).del("event:e3");
    }
}
