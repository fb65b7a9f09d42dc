package com.lineguard.backend.config;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.ByteArrayInputStream;
import java.io.FileInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Firestore client. Credentials come from an inline JSON string, a file path,
 * or the environment's default credentials, in that order. Without any of
 * them no client is created and repositories run empty.
 */
@Configuration
@Slf4j
public class FirestoreConfig {

    @Value("${firestore.project-id:}")
    private String projectId;

    @Value("${fcm.service-account-path:}")
    private String credentialsPath;

    @Value("${fcm.service-account-json:}")
    private String credentialsJson;

    @Bean
    public Firestore firestore() throws IOException {
        GoogleCredentials credentials = loadCredentials(credentialsJson, credentialsPath);

        if (credentials == null) {
            log.warn("⚠️ Firestore credentials not configured. Route and reference data will be empty.");
            return null;
        }

        FirestoreOptions.Builder builder = FirestoreOptions.newBuilder()
                .setCredentials(credentials);

        if (!projectId.isEmpty()) {
            builder.setProjectId(projectId);
        }

        Firestore firestore = builder.build().getService();
        log.info("✅ Firestore initialized for project: {}", projectId.isEmpty() ? "(default)" : projectId);
        return firestore;
    }

    /**
     * Shared with the FCM dispatcher, which authenticates with the same
     * service account.
     */
    public static GoogleCredentials loadCredentials(String json, String path) throws IOException {
        if (json != null && !json.isEmpty()) {
            log.info("🔐 Loading Google credentials from JSON string");
            return GoogleCredentials.fromStream(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
        }

        if (path != null && !path.isEmpty()) {
            log.info("🔐 Loading Google credentials from file: {}", path);
            try (FileInputStream stream = new FileInputStream(path)) {
                return GoogleCredentials.fromStream(stream);
            }
        }

        try {
            return GoogleCredentials.getApplicationDefault();
        } catch (IOException e) {
            log.warn("⚠️ No Google application default credentials found: {}", e.getMessage());
            return null;
        }
    }
}
