package com.ecoWasteEngine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ecoWasteEngine.classifier.ClassifierAdapter;
import com.ecoWasteEngine.classifier.ClassifierPrediction;
import com.ecoWasteEngine.model.StepResult;
import com.ecoWasteEngine.model.enums.WasteCategory;
import com.ecoWasteEngine.service.RewardLedger;
import com.ecoWasteEngine.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.JsonPath;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Upload, classification, reward and pickup through the HTTP surface, backed
 * by the in-memory stores.
 */
@SpringBootTest
@AutoConfigureMockMvc
class WasteEntryLifecycleTest {

    private static final String CITIZEN = "citizen-1";

    @TestConfiguration
    static class FixedClockConfig {

        @Bean
        @Primary
        MutableClock testClock() {
            return MutableClock.at("2026-03-08T09:00:00Z");
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private RewardLedger rewardLedger;

    @Autowired
    private MutableClock clock;

    @MockBean
    private ClassifierAdapter classifierAdapter;

    @Test
    void plasticBottleFromUploadToAssignedPickup() throws Exception {
        // two earlier days of activity
        clock.set(Instant.parse("2026-03-08T09:00:00Z"));
        rewardLedger.apply(CITIZEN, "earlier-1", WasteCategory.RECYCLABLE);
        clock.set(Instant.parse("2026-03-09T09:00:00Z"));
        rewardLedger.apply(CITIZEN, "earlier-2", WasteCategory.RECYCLABLE);
        assertThat(rewardLedger.getState(CITIZEN).getCurrentStreak()).isEqualTo(2);

        clock.set(Instant.parse("2026-03-10T09:00:00Z"));
        when(classifierAdapter.classify(any(), any()))
                .thenReturn(StepResult.ok(ClassifierPrediction.fromLabels("plastic", null, 0.92, "test-model")));
        MockMultipartFile photo = new MockMultipartFile(
                "file", "bottle.jpg", "image/jpeg", "plastic-bottle".getBytes(StandardCharsets.UTF_8));

        String submission = mockMvc.perform(multipart("/api/v1/entries").file(photo).with(user(CITIZEN)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.replayed").value(false))
                .andExpect(jsonPath("$.status").value("CLASSIFIED"))
                .andExpect(jsonPath("$.classification.confidence_tier").value("HIGH"))
                .andExpect(jsonPath("$.classification.recommended_bin").value("BLUE"))
                .andExpect(jsonPath("$.classification.manual_review").value(false))
                .andReturn().getResponse().getContentAsString();
        String entryId = JsonPath.read(submission, "$.entry_id");

        // same photo again inside the window
        mockMvc.perform(multipart("/api/v1/entries").file(photo).with(user(CITIZEN)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.replayed").value(true))
                .andExpect(jsonPath("$.entry_id").value(entryId));

        awaitStreak(3);
        mockMvc.perform(get("/api/v1/users/{id}/reward-state", CITIZEN).with(user(CITIZEN)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.current_streak").value(3))
                .andExpect(jsonPath("$.total_points").value(45 + 15 + 40))
                .andExpect(jsonPath("$.level").value(2))
                .andExpect(jsonPath("$.achievements[0]").value("FIRST_SORT"));
        mockMvc.perform(get("/api/v1/users/{id}/achievements", CITIZEN).with(user(CITIZEN)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].code").value("FIRST_SORT"))
                .andExpect(jsonPath("$[0].unlocked").value(true))
                .andExpect(jsonPath("$[1].unlocked").value(false));

        String pickup = mockMvc.perform(post("/api/v1/pickups")
                        .with(user(CITIZEN))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "entry_id", entryId,
                                "address", "12 Green Street"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("REQUESTED"))
                .andExpect(jsonPath("$.version").value(0))
                .andReturn().getResponse().getContentAsString();
        String pickupId = JsonPath.read(pickup, "$.id");

        mockMvc.perform(post("/api/v1/pickups/{id}/transition", pickupId)
                        .with(user("dispatcher-1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "to_status", "ASSIGNED",
                                "version", 0,
                                "driver_id", "driver-7"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ASSIGNED"))
                .andExpect(jsonPath("$.version").value(1))
                .andExpect(jsonPath("$.assigned_driver_id").value("driver-7"));

        mockMvc.perform(post("/api/v1/pickups/{id}/transition", pickupId)
                        .with(user("driver-7"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "to_status", "EN_ROUTE",
                                "version", 0))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("PICKUP_CONFLICT"));
    }

    @Test
    void skippedPickupStepIsAnInvalidTransition() throws Exception {
        clock.set(Instant.parse("2026-03-20T09:00:00Z"));
        when(classifierAdapter.classify(any(), any()))
                .thenReturn(StepResult.ok(ClassifierPrediction.fromLabels("cardboard", null, 0.88, "test-model")));
        MockMultipartFile photo = new MockMultipartFile(
                "file", "box.png", "image/png", "cardboard-box".getBytes(StandardCharsets.UTF_8));
        String submission = mockMvc.perform(multipart("/api/v1/entries").file(photo).with(user("citizen-2")))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        String entryId = JsonPath.read(submission, "$.entry_id");

        String pickup = mockMvc.perform(post("/api/v1/pickups")
                        .with(user("citizen-2"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "waste_entry_id", entryId,
                                "address", "3 Hill Road"))))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        String pickupId = JsonPath.read(pickup, "$.id");

        mockMvc.perform(post("/api/v1/pickups/{id}/transition", pickupId)
                        .with(user("driver-7"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "to_status", "COLLECTED",
                                "version", 0))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INVALID_TRANSITION"));
    }

    @Test
    void classifierOutageStillStoresTheEntry() throws Exception {
        when(classifierAdapter.classify(any(), any())).thenReturn(StepResult.failed(
                new com.ecoWasteEngine.exception.ClassifierUnavailableException("down", null)));
        MockMultipartFile photo = new MockMultipartFile(
                "file", "thing.jpg", "image/jpeg", "mystery-item".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/v1/entries").file(photo).with(user("citizen-3")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("UNCLASSIFIED"))
                .andExpect(jsonPath("$.reward_queued").value(false));
    }

    @Test
    void nonImageUploadIsRejected() throws Exception {
        MockMultipartFile document = new MockMultipartFile(
                "file", "notes.pdf", "application/pdf", "%PDF".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/v1/entries").file(document).with(user(CITIZEN)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    void otherUsersEntriesAreHidden() throws Exception {
        when(classifierAdapter.classify(any(), any()))
                .thenReturn(StepResult.ok(ClassifierPrediction.fromLabels("paper", null, 0.95, "test-model")));
        MockMultipartFile photo = new MockMultipartFile(
                "file", "paper.jpg", "image/jpeg", "newspaper".getBytes(StandardCharsets.UTF_8));
        String submission = mockMvc.perform(multipart("/api/v1/entries").file(photo).with(user("citizen-4")))
                .andReturn().getResponse().getContentAsString();
        String entryId = JsonPath.read(submission, "$.entry_id");

        mockMvc.perform(get("/api/v1/entries/{id}", entryId).with(user("citizen-4")))
                .andExpect(status().isOk());
        mockMvc.perform(get("/api/v1/entries/{id}", entryId).with(user("citizen-5")))
                .andExpect(status().isForbidden());
    }

    @Test
    void healthIsPublicAndEverythingElseNeedsAUser() throws Exception {
        mockMvc.perform(get("/api/v1/health")).andExpect(status().isOk());
        mockMvc.perform(get("/api/v1/leaderboard"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));
        mockMvc.perform(get("/api/v1/users/{id}/achievements", CITIZEN)).andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/v1/leaderboard").with(user(CITIZEN))).andExpect(status().isOk());
    }

    @Test
    void routesOutsideTheApiAreDenied() throws Exception {
        mockMvc.perform(get("/api/v1/entries").with(user(CITIZEN))).andExpect(status().isOk());
        mockMvc.perform(get("/api/v1/admin/users").with(user(CITIZEN))).andExpect(status().isForbidden());
        mockMvc.perform(delete("/api/v1/pickups/{id}", "p1").with(user(CITIZEN))).andExpect(status().isForbidden());
    }

    @Test
    void corsPreflightAllowsTheConfiguredOrigin() throws Exception {
        mockMvc.perform(options("/api/v1/entries")
                        .header("Origin", "http://localhost:3000")
                        .header("Access-Control-Request-Method", "POST")
                        .header("Access-Control-Request-Headers", "Authorization"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "http://localhost:3000"));
        mockMvc.perform(options("/api/v1/entries")
                        .header("Origin", "http://evil.example")
                        .header("Access-Control-Request-Method", "POST"))
                .andExpect(status().isForbidden());
    }

    private void awaitStreak(int expected) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (rewardLedger.getState(CITIZEN).getCurrentStreak() != expected && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
    }
}
