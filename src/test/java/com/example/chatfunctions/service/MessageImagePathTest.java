package com.example.chatfunctions.service;

import com.example.chatfunctions.error.MalformedObjectReferenceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class MessageImagePathTest {

    @Test
    void testDecode_SecondSegmentIsMessageId() {
        // When
        MessageImagePath path = MessageImagePath.decode("images/msg123/photo.png");

        // Then
        assertEquals("msg123", path.getMessageId());
        assertEquals("photo.png", path.getFileName());
        assertEquals("images/msg123/photo.png", path.getPath());
    }

    @Test
    void testDecode_DeeperPathUsesLastSegment() {
        // When
        MessageImagePath path = MessageImagePath.decode("uid42/msg7/thumbs/small.jpg");

        // Then
        assertEquals("msg7", path.getMessageId());
        assertEquals("small.jpg", path.getFileName());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"photo.png", "images/photo.png", "images//photo.png", "/msg/photo.png",
            "images/msg/", "images/../photo.png"})
    void testDecode_RejectsPathWithoutMessageSegment(String path) {
        // When / Then
        assertThrows(MalformedObjectReferenceException.class, () -> MessageImagePath.decode(path));
    }
}
