package com.ecoWasteEngine.config;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.cloud.FirestoreClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;

/** Firebase Admin SDK wiring, only active when entries are kept in Firestore. */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "waste-engine.store", havingValue = "firestore", matchIfMissing = true)
public class FirebaseConfig {

    @Value("${firebase.service-account:classpath:serviceAccountKey.json}")
    private String serviceAccountPath;

    @Value("${firebase.storage-bucket}")
    private String storageBucket;

    @PostConstruct
    public void initialize() {
        if (!FirebaseApp.getApps().isEmpty()) {
            return;
        }
        try (InputStream serviceAccount = resolveServiceAccount()) {
            if (serviceAccount == null) {
                throw new IllegalStateException("Firebase service account not found at " + serviceAccountPath);
            }

            FirebaseOptions options = FirebaseOptions.builder()
                    .setCredentials(GoogleCredentials.fromStream(serviceAccount))
                    .setStorageBucket(storageBucket)
                    .build();

            FirebaseApp.initializeApp(options);
            log.info("Firebase Admin SDK initialization completed (bucket={})", storageBucket);
        } catch (IOException e) {
            throw new IllegalStateException("Firebase init error: " + e.getMessage(), e);
        }
    }

    @Bean
    public Firestore firestore() {
        return FirestoreClient.getFirestore();
    }

    private InputStream resolveServiceAccount() {
        if (serviceAccountPath.startsWith("file:")) {
            String filePath = serviceAccountPath.substring(5);
            try {
                return new FileInputStream(filePath);
            } catch (FileNotFoundException e) {
                log.error("File not found: {}", filePath);
                return null;
            }
        } else if (serviceAccountPath.startsWith("classpath:")) {
            String resourceName = serviceAccountPath.substring(10);
            return getClass().getClassLoader().getResourceAsStream(resourceName);
        }
        return getClass().getClassLoader().getResourceAsStream("serviceAccountKey.json");
    }
}
