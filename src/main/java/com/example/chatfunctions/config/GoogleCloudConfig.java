package com.example.chatfunctions.config;

import com.google.api.gax.core.FixedCredentialsProvider;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import com.google.cloud.vision.v1.ImageAnnotatorClient;
import com.google.cloud.vision.v1.ImageAnnotatorSettings;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.messaging.FirebaseMessaging;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds the Google Cloud and Firebase clients once per process; handlers receive them by injection.
 */
@Configuration
@EnableConfigurationProperties(GoogleCloudProps.class)
public class GoogleCloudConfig {

    private static final Logger logger = LoggerFactory.getLogger(GoogleCloudConfig.class);
    private static final String APP_NAME = "chat-functions";

    @Bean
    public GoogleCredentials googleCredentials(GoogleCloudProps props) throws IOException {
        if (!StringUtils.hasText(props.getCredentialsPath())) {
            logger.info("Using Application Default Credentials");
            return GoogleCredentials.getApplicationDefault();
        }
        logger.info("Loading service account credentials from {}", props.getCredentialsPath());
        try (InputStream in = Files.newInputStream(Path.of(props.getCredentialsPath()))) {
            return GoogleCredentials.fromStream(in);
        }
    }

    @Bean(destroyMethod = "delete")
    public FirebaseApp firebaseApp(GoogleCredentials credentials, GoogleCloudProps props) {
        FirebaseOptions.Builder options = FirebaseOptions.builder().setCredentials(credentials);
        if (StringUtils.hasText(props.getProjectId())) options.setProjectId(props.getProjectId());
        if (StringUtils.hasText(props.getStorageBucket())) options.setStorageBucket(props.getStorageBucket());
        return FirebaseApp.initializeApp(options.build(), APP_NAME);
    }

    @Bean
    public FirebaseMessaging firebaseMessaging(FirebaseApp app) {
        return FirebaseMessaging.getInstance(app);
    }

    @Bean
    public Storage storage(GoogleCredentials credentials, GoogleCloudProps props) {
        StorageOptions.Builder options = StorageOptions.newBuilder().setCredentials(credentials);
        if (StringUtils.hasText(props.getProjectId())) options.setProjectId(props.getProjectId());
        return options.build().getService();
    }

    @Bean
    public ImageAnnotatorClient imageAnnotatorClient(GoogleCredentials credentials) throws IOException {
        return ImageAnnotatorClient.create(ImageAnnotatorSettings.newBuilder()
                .setCredentialsProvider(FixedCredentialsProvider.create(credentials))
                .build());
    }
}
