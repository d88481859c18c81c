package com.ecoWasteEngine.service;

import com.ecoWasteEngine.config.EngineConfig;
import com.ecoWasteEngine.config.WasteEngineProperties;
import com.ecoWasteEngine.exception.RewardComputationException;
import com.ecoWasteEngine.model.RewardTask;
import com.ecoWasteEngine.model.RewardTransaction;
import com.ecoWasteEngine.model.StepResult;
import com.ecoWasteEngine.model.Timestamps;
import com.ecoWasteEngine.model.enums.RewardTaskStatus;
import com.ecoWasteEngine.model.enums.WasteCategory;
import com.ecoWasteEngine.store.RewardTaskQueue;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands reward application to a background worker. The task is written to
 * the durable queue first, so a crash or a full worker pool only delays it:
 * the re-drive job picks up anything still PENDING.
 */
@Slf4j
@Service
public class RewardDispatcher {

    private final RewardTaskQueue taskQueue;
    private final RewardLedger ledger;
    private final TaskExecutor executor;
    private final Clock clock;
    private final RetryConfig retryConfig;

    public RewardDispatcher(RewardTaskQueue taskQueue,
            RewardLedger ledger,
            @Qualifier(EngineConfig.REWARD_EXECUTOR) TaskExecutor executor,
            Clock clock,
            WasteEngineProperties properties) {
        this.taskQueue = taskQueue;
        this.ledger = ledger;
        this.executor = executor;
        this.clock = clock;
        this.retryConfig = RetryConfig.custom()
                .maxAttempts(properties.getRewards().getMaxAttempts())
                .waitDuration(properties.getRewards().getRetryBackoff())
                .ignoreExceptions(IllegalArgumentException.class)
                .build();
    }

    /**
     * Queues the reward for {@code entryId} and schedules it. Never throws: a
     * failure to queue comes back as a failed result.
     */
    public StepResult<RewardTask> dispatch(String userId, String entryId, WasteCategory category) {
        RewardTask task;
        try {
            task = taskQueue.enqueue(RewardTask.builder()
                    .entryId(entryId)
                    .userId(userId)
                    .category(category)
                    .status(RewardTaskStatus.PENDING)
                    .attempts(0)
                    .enqueuedAt(Timestamps.now(clock))
                    .updatedAt(Timestamps.now(clock))
                    .build());
        } catch (RuntimeException e) {
            log.error("[Reward] Could not queue reward for entry {}: {}", entryId, e.getMessage(), e);
            return StepResult.failed(new RewardComputationException("Could not queue reward for " + entryId, e));
        }
        schedule(task);
        return StepResult.ok(task);
    }

    /** Re-runs a task that is still PENDING */
    public void redrive(RewardTask task) {
        if (task.getStatus() != RewardTaskStatus.PENDING) {
            return;
        }
        log.info("[Reward] Re-driving reward for entry {} (enqueued {})", task.getEntryId(), task.getEnqueuedAt());
        schedule(task);
    }

    private void schedule(RewardTask task) {
        try {
            executor.execute(() -> run(task));
        } catch (RejectedExecutionException e) {
            log.warn("[Reward] Worker pool full, entry {} stays queued for re-drive", task.getEntryId());
        }
    }

    /** Applies the reward with retries, then records the outcome on the task. */
    StepResult<RewardTransaction> run(RewardTask task) {
        Retry retry = Retry.of("reward-" + task.getEntryId(), retryConfig);
        AtomicInteger attempts = new AtomicInteger();
        try {
            RewardTransaction transaction = Retry.decorateSupplier(retry, () -> {
                attempts.incrementAndGet();
                return ledger.apply(task.getUserId(), task.getEntryId(), task.getCategory());
            }).get();
            taskQueue.markCompleted(task.getEntryId(), attempts.get());
            return StepResult.ok(transaction);
        } catch (RuntimeException e) {
            log.error("[Reward] Abandoning reward for entry {} after {} attempt(s): {}",
                    task.getEntryId(), attempts.get(), e.getMessage(), e);
            try {
                taskQueue.markAbandoned(task.getEntryId(), attempts.get(), e.getMessage());
            } catch (RuntimeException markError) {
                log.error("[Reward] Could not mark entry {} as abandoned, it stays PENDING",
                        task.getEntryId(), markError);
            }
            return StepResult.failed(new RewardComputationException(
                    "Reward for entry " + task.getEntryId() + " failed", e));
        }
    }
}
