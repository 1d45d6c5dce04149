package com.example.chatfunctions.kv;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisKvClientTest {

    @Mock
    private StringRedisTemplate redis;

    @Mock
    private ValueOperations<String, String> values;

    private RedisKvClient client;

    @BeforeEach
    void setUp() {
        client = new RedisKvClient(redis);
    }

    @Test
    void testSetIfAbsent_WithTtl() {
        // Given
        when(redis.opsForValue()).thenReturn(values);
        when(values.setIfAbsent("event:e1", "x", Duration.ofMinutes(5))).thenReturn(true);

        // When / Then
        assertTrue(client.setIfAbsent("event:e1", "x", Duration.ofMinutes(5)));
    }

    @Test
    void testSetIfAbsent_NullReplyCountsAsNotSet() {
        // Given
        when(redis.opsForValue()).thenReturn(values);
        when(values.setIfAbsent("event:e1", "x")).thenReturn(null);

        // When / Then
        assertFalse(client.setIfAbsent("event:e1", "x", null));
    }

    @Test
    void testExistsAndDel() {
        // Given
        when(redis.hasKey("k")).thenReturn(true);

        // When
        boolean exists = client.exists("k");
        client.del("k");

        // Then
        assertTrue(exists);
        verify(redis).delete("k");
    }
}
