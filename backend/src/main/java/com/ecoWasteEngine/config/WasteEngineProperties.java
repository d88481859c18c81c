package com.ecoWasteEngine.config;

import com.ecoWasteEngine.model.enums.WasteCategory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "waste-engine")
@Data
public class WasteEngineProperties {

    private StoreMode store = StoreMode.FIRESTORE;
    private Ingestion ingestion = new Ingestion();
    private Classifier classifier = new Classifier();
    private Policy policy = new Policy();
    private Rewards rewards = new Rewards();
    private Pickup pickup = new Pickup();

    public enum StoreMode {
        FIRESTORE, MEMORY
    }

    @Data
    public static class Ingestion {
        private long maxImageBytes = 10L * 1024 * 1024;
        private List<String> acceptedContentTypes = new ArrayList<>(
                List.of("image/jpeg", "image/png", "image/webp", "image/heic"));
        private Duration dedupWindow = Duration.ofSeconds(60);
        /** How long a duplicate waits for the first submission's record to appear */
        private Duration replayWait = Duration.ofSeconds(2);
        /** PENDING entries older than this are classified again by the scheduler */
        private Duration pendingRedriveAfter = Duration.ofMinutes(5);
        private Duration pendingRedriveInterval = Duration.ofMinutes(2);
        private int pendingRedriveBatch = 50;
    }

    @Data
    public static class Classifier {
        private ClassifierType type = ClassifierType.STUB;
        private Duration timeout = Duration.ofSeconds(5);
        private String endpoint;
        private int workerThreads = 4;

        public enum ClassifierType {
            STUB, MOBILENET, CLIP
        }
    }

    @Data
    public static class Policy {
        private double highThreshold = 0.80;
        private double mediumThreshold = 0.50;
    }

    @Data
    public static class Rewards {
        private int basePoints = 10;
        /** Extra points for categories worth encouraging */
        private Map<WasteCategory, Integer> categoryBonus = new EnumMap<>(Map.of(
                WasteCategory.RECYCLABLE, 5,
                WasteCategory.ORGANIC, 5,
                WasteCategory.HAZARDOUS, 3));
        /** Paid once, with the user's first rewarded entry */
        private int firstTimeBonus = 20;
        private Map<Integer, Integer> streakMilestones = new LinkedHashMap<>(Map.of(
                3, 25,
                7, 75,
                14, 200,
                30, 500,
                60, 1000,
                90, 2000,
                180, 5000,
                365, 10000));
        private List<Long> levelThresholds = new ArrayList<>(
                List.of(0L, 100L, 300L, 600L, 1000L, 1500L, 2200L, 3000L, 4000L, 5200L));
        private int maxAttempts = 3;
        private Duration retryBackoff = Duration.ofMillis(200);
        private Duration redriveAfter = Duration.ofMinutes(5);
        private Duration redriveInterval = Duration.ofMinutes(1);
        private int workerThreads = 2;
    }

    @Data
    public static class Pickup {
        private Duration requestTimeout = Duration.ofHours(72);
        private int timeoutMaxAttempts = 3;
        private String timeoutCron = "0 0 * * * *";
    }
}
