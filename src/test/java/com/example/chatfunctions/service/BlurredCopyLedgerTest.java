package com.example.chatfunctions.service;

import com.example.chatfunctions.kv.KvClient;
import com.example.chatfunctions.model.ObjectRef;
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
class BlurredCopyLedgerTest {

    private static final ObjectRef REF = new ObjectRef("chat-app.appspot.com", "images/msg1/a.png");
    private static final String KEY = "moderated:chat-app.appspot.com/images/msg1/a.png:42";

    @Mock
    private KvClient kvClient;

    private BlurredCopyLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new BlurredCopyLedger(kvClient);
        ReflectionTestUtils.setField(ledger, "ttlSeconds", 3600L);
    }

    @Test
    void testRecord_StoresGenerationKeyWithTtl() {
        // When
        ledger.record(REF, 42L);

        // Then
        verify(kvClient).setIfAbsent(KEY, "blurred", Duration.ofSeconds(3600));
    }

    @Test
    void testRecord_MissingGenerationWritesNothing() {
        // When
        ledger.record(REF, null);

        // Then
        verifyNoInteractions(kvClient);
    }

    @Test
    void testRecord_KvFailureIsNotPropagated() {
        // Given
        when(kvClient.setIfAbsent(anyString(), anyString(), any())).thenThrow(new IllegalStateException("connection refused"));

        // When / Then
        assertDoesNotThrow(() -> ledger.record(REF, 42L));
    }

    @Test
    void testIsBlurredCopy_RecordedGeneration() {
        // Given
        when(kvClient.exists(KEY)).thenReturn(true);

        // When / Then
        assertTrue(ledger.isBlurredCopy(REF, 42L));
    }

    @Test
    void testIsBlurredCopy_OtherGeneration() {
        // Given
        when(kvClient.exists("moderated:chat-app.appspot.com/images/msg1/a.png:43")).thenReturn(false);

        // When / Then
        assertFalse(ledger.isBlurredCopy(REF, 43L));
    }

    @Test
    void testIsBlurredCopy_MissingGeneration() {
        // When / Then
        assertFalse(ledger.isBlurredCopy(REF, null));
        verifyNoInteractions(kvClient);
    }

    @Test
    void testIsBlurredCopy_KvFailureMeansClassifyAgain() {
        // Given
        when(kvClient.exists(anyString())).thenThrow(new IllegalStateException("connection refused"));

        // When / Then
        assertFalse(ledger.isBlurredCopy(REF, 42L));
    }
}
