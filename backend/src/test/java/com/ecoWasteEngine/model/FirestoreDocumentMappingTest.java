package com.ecoWasteEngine.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.ecoWasteEngine.model.enums.BinType;
import com.ecoWasteEngine.model.enums.ConfidenceTier;
import com.ecoWasteEngine.model.enums.PickupStatus;
import com.ecoWasteEngine.model.enums.RewardTaskStatus;
import com.ecoWasteEngine.model.enums.WasteCategory;
import com.ecoWasteEngine.model.enums.WasteEntryStatus;
import com.google.cloud.Timestamp;
import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

/**
 * Documents must carry the snake_case keys the Firestore queries filter and
 * order on, and read back into the same objects.
 */
class FirestoreDocumentMappingTest {

    private static final Timestamp AT = Timestamp.ofTimeSecondsAndNanos(1_773_000_000L, 0);

    private static Method toPlain;
    private static Method toObject;

    @BeforeAll
    static void openMapper() throws Exception {
        // the SDK keeps its bean mapper package-private
        Class<?> mapper = Class.forName("com.google.cloud.firestore.CustomClassMapper");
        toPlain = mapper.getDeclaredMethod("convertToPlainJavaTypes", Object.class);
        toPlain.setAccessible(true);
        toObject = mapper.getDeclaredMethod("convertToCustomClass", Object.class, Class.class,
                Class.forName("com.google.cloud.firestore.DocumentReference"));
        toObject.setAccessible(true);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> document(Object model) throws Exception {
        return (Map<String, Object>) toPlain.invoke(null, model);
    }

    private static <T> T read(Map<String, Object> document, Class<T> type) throws Exception {
        return type.cast(toObject.invoke(null, document, type, null));
    }

    @Test
    void pickupUsesQueryFieldNames() throws Exception {
        Pickup pickup = Pickup.builder()
                .id("p1")
                .wasteEntryId("e1")
                .userId("u1")
                .address("12 Green Street")
                .status(PickupStatus.REQUESTED)
                .assignedDriverId("d1")
                .manualHandling(true)
                .scheduledDate("2026-03-12")
                .createdAt(AT)
                .updatedAt(AT)
                .build();

        Map<String, Object> doc = document(pickup);

        assertThat(doc).containsEntry("waste_entry_id", "e1")
                .containsEntry("user_id", "u1")
                .containsEntry("assigned_driver_id", "d1")
                .containsEntry("manual_handling", true)
                .containsEntry("scheduled_date", "2026-03-12")
                .containsEntry("created_at", AT)
                .containsEntry("status", "REQUESTED")
                .doesNotContainKeys("wasteEntryId", "createdAt", "userId");
        assertThat(read(doc, Pickup.class)).isEqualTo(pickup);
    }

    @Test
    void wasteEntryAndClassificationUseQueryFieldNames() throws Exception {
        WasteEntry entry = WasteEntry.builder()
                .id("e1")
                .submitterId("u1")
                .fingerprint("abc")
                .imageRef("waste-entries/e1.jpg")
                .contentType("image/jpeg")
                .status(WasteEntryStatus.CLASSIFIED)
                .classification(Classification.builder()
                        .category(WasteCategory.RECYCLABLE)
                        .confidence(0.92)
                        .confidenceTier(ConfidenceTier.HIGH)
                        .recommendedBin(BinType.BLUE)
                        .handlingInstructions(List.of("Rinse it"))
                        .modelName("stub")
                        .build())
                .createdAt(AT)
                .finalizedAt(AT)
                .statusHistory(List.of(EntryStatusChange.builder().status(WasteEntryStatus.PENDING).at(AT).build()))
                .build();

        Map<String, Object> doc = document(entry);

        assertThat(doc).containsKeys("submitter_id", "image_ref", "content_type", "created_at",
                "finalized_at", "status_history");
        assertThat(doc).doesNotContainKeys("submitterId", "createdAt");
        @SuppressWarnings("unchecked")
        Map<String, Object> classification = (Map<String, Object>) doc.get("classification");
        assertThat(classification).containsKeys("confidence_tier", "recommended_bin",
                "handling_instructions", "manual_review_required", "model_name");
        assertThat(read(doc, WasteEntry.class)).isEqualTo(entry);
    }

    @Test
    void rewardDocumentsUseQueryFieldNames() throws Exception {
        RewardTask task = RewardTask.builder()
                .entryId("e1")
                .userId("u1")
                .category(WasteCategory.ORGANIC)
                .status(RewardTaskStatus.PENDING)
                .enqueuedAt(AT)
                .build();
        RewardTransaction transaction = RewardTransaction.builder()
                .entryId("e1")
                .userId("u1")
                .category(WasteCategory.ORGANIC)
                .basePoints(10)
                .pointsAwarded(35)
                .createdAt(AT)
                .build();
        RewardState state = RewardState.empty("u1").toBuilder()
                .totalPoints(35)
                .lastActivityDate("2026-03-10")
                .build();

        assertThat(document(task)).containsKeys("entry_id", "user_id", "enqueued_at", "last_error")
                .doesNotContainKey("enqueuedAt");
        assertThat(document(transaction)).containsKeys("entry_id", "user_id", "created_at", "points_awarded")
                .doesNotContainKey("createdAt");
        assertThat(document(state)).containsKeys("user_id", "total_points", "current_streak", "last_activity_date");

        assertThat(read(document(task), RewardTask.class)).isEqualTo(task);
        assertThat(read(document(transaction), RewardTransaction.class)).isEqualTo(transaction);
        assertThat(read(document(state), RewardState.class)).isEqualTo(state);
    }
}
