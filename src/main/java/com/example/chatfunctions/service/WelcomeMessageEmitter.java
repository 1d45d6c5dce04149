package com.example.chatfunctions.service;

import com.example.chatfunctions.model.Message;
import com.example.chatfunctions.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class WelcomeMessageEmitter {

    private static final Logger logger = LoggerFactory.getLogger(WelcomeMessageEmitter.class);

    static final String ANONYMOUS = "Anonymous";

    private final DocumentStore documentStore;

    @Value("${app.collections.messages:messages}")
    private String messagesCollection;

    @Value("${app.welcome.bot-name:Firebase Bot}")
    private String botName;

    @Value("${app.welcome.bot-profile-pic-url:/images/firebase-logo.png}")
    private String botProfilePicUrl;

    public WelcomeMessageEmitter(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    public WelcomeResult welcome(String displayName) {
        logger.info("A new user signed in for the first time");
        String text = welcomeText(displayName);

        Map<String, Object> fields = Message.builder()
                .name(botName)
                .profilePicUrl(botProfilePicUrl)
                .text(text)
                .build()
                .toFields();
        fields.put("timestamp", DocumentStore.SERVER_TIMESTAMP);

        try {
            String id = documentStore.add(messagesCollection, fields);
            logger.info("Welcome message {} written to database", id);
            return WelcomeResult.written(id, text);
        } catch (RuntimeException e) {
            logger.error("Writing welcome message failed", e);
            return WelcomeResult.failed(text, e.getMessage());
        }
    }

    static String welcomeText(String displayName) {
        String fullName = displayName == null || displayName.isEmpty() ? ANONYMOUS : displayName;
        return fullName + " signed in for the first time! Welcome!";
    }
}
