package com.ecoWasteEngine.store.firestore;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.FieldValue;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.ecoWasteEngine.model.RewardTask;
import com.ecoWasteEngine.model.Timestamps;
import com.ecoWasteEngine.model.enums.RewardTaskStatus;
import com.ecoWasteEngine.store.RewardTaskQueue;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@ConditionalOnProperty(name = "waste-engine.store", havingValue = "firestore", matchIfMissing = true)
@RequiredArgsConstructor
public class FirestoreRewardTaskQueue implements RewardTaskQueue {

    private static final String COLLECTION_NAME = "reward_tasks";

    private final Firestore firestore;
    private final Clock clock;

    @Override
    public RewardTask enqueue(RewardTask task) {
        DocumentReference docRef = firestore.collection(COLLECTION_NAME).document(task.getEntryId());
        return FirestoreCalls.await(firestore.runTransaction(transaction -> {
            DocumentSnapshot doc = transaction.get(docRef).get();
            if (doc.exists()) {
                return doc.toObject(RewardTask.class);
            }
            RewardTask pending = task.toBuilder().status(RewardTaskStatus.PENDING).build();
            transaction.set(docRef, pending);
            return pending;
        }), "enqueue reward task " + task.getEntryId());
    }

    @Override
    public Optional<RewardTask> find(String entryId) {
        DocumentSnapshot doc = FirestoreCalls.await(
                firestore.collection(COLLECTION_NAME).document(entryId).get(), "get reward task " + entryId);
        return doc.exists() ? Optional.of(doc.toObject(RewardTask.class)) : Optional.empty();
    }

    @Override
    public void markCompleted(String entryId, int attempts) {
        update(entryId, RewardTaskStatus.COMPLETED, attempts, null);
    }

    @Override
    public void markAbandoned(String entryId, int attempts, String lastError) {
        update(entryId, RewardTaskStatus.ABANDONED, attempts, lastError);
    }

    @Override
    public List<RewardTask> findPendingEnqueuedBefore(Timestamp cutoff) {
        List<RewardTask> tasks = new ArrayList<>();
        for (QueryDocumentSnapshot doc : FirestoreCalls.await(firestore.collection(COLLECTION_NAME)
                .whereEqualTo("status", RewardTaskStatus.PENDING.name())
                .whereLessThan("enqueued_at", cutoff)
                .get(), "list pending reward tasks").getDocuments()) {
            tasks.add(doc.toObject(RewardTask.class));
        }
        return tasks;
    }

    private void update(String entryId, RewardTaskStatus status, int attempts, String lastError) {
        Map<String, Object> fields = new HashMap<>();
        fields.put("status", status.name());
        fields.put("attempts", FieldValue.increment(attempts));
        fields.put("last_error", lastError);
        fields.put("updated_at", Timestamps.now(clock));
        FirestoreCalls.await(firestore.collection(COLLECTION_NAME).document(entryId).update(fields),
                "update reward task " + entryId);
    }
}
