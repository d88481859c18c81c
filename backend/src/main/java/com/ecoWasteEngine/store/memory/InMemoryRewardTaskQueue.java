package com.ecoWasteEngine.store.memory;

import com.ecoWasteEngine.model.RewardTask;
import com.ecoWasteEngine.model.Timestamps;
import com.ecoWasteEngine.model.enums.RewardTaskStatus;
import com.ecoWasteEngine.store.RewardTaskQueue;
import com.google.cloud.Timestamp;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

@Component
@ConditionalOnProperty(name = "waste-engine.store", havingValue = "memory")
@RequiredArgsConstructor
public class InMemoryRewardTaskQueue implements RewardTaskQueue {

    private final ConcurrentMap<String, RewardTask> tasks = new ConcurrentHashMap<>();
    private final Clock clock;

    @Override
    public RewardTask enqueue(RewardTask task) {
        RewardTask stored = tasks.computeIfAbsent(task.getEntryId(), k -> task.toBuilder()
                .status(RewardTaskStatus.PENDING)
                .build());
        return stored.toBuilder().build();
    }

    @Override
    public Optional<RewardTask> find(String entryId) {
        return Optional.ofNullable(tasks.get(entryId)).map(t -> t.toBuilder().build());
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
        return tasks.values().stream()
                .filter(t -> t.getStatus() == RewardTaskStatus.PENDING)
                .filter(t -> t.getEnqueuedAt().compareTo(cutoff) < 0)
                .sorted(Comparator.comparing(RewardTask::getEnqueuedAt))
                .map(t -> t.toBuilder().build())
                .collect(Collectors.toList());
    }

    private void update(String entryId, RewardTaskStatus status, int attempts, String lastError) {
        tasks.computeIfPresent(entryId, (k, current) -> current.toBuilder()
                .status(status)
                .attempts(current.getAttempts() + attempts)
                .lastError(lastError)
                .updatedAt(Timestamps.now(clock))
                .build());
    }
}
