package com.example.chatfunctions.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "google.cloud")
public class GoogleCloudProps {
    private String projectId;
    /** Service account JSON. Blank means Application Default Credentials. */
    private String credentialsPath;
    private String storageBucket;
}
