package com.ecoWasteEngine.store;

import com.ecoWasteEngine.model.RewardTask;
import com.google.cloud.Timestamp;

import java.util.List;
import java.util.Optional;

/** Durable queue of reward applications, keyed by entry id. */
public interface RewardTaskQueue {

    /** Stores the task as PENDING. Enqueueing the same entry twice keeps the first task. */
    RewardTask enqueue(RewardTask task);

    Optional<RewardTask> find(String entryId);

    void markCompleted(String entryId, int attempts);

    void markAbandoned(String entryId, int attempts, String lastError);

    List<RewardTask> findPendingEnqueuedBefore(Timestamp cutoff);
}
