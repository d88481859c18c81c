package com.ecoWasteEngine.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.ecoWasteEngine.config.WasteEngineProperties;
import com.ecoWasteEngine.model.RewardTask;
import com.ecoWasteEngine.model.Timestamps;
import com.ecoWasteEngine.model.enums.RewardTaskStatus;
import com.ecoWasteEngine.model.enums.WasteCategory;
import com.ecoWasteEngine.service.RewardDispatcher;
import com.ecoWasteEngine.store.memory.InMemoryRewardTaskQueue;
import com.ecoWasteEngine.support.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class RewardTaskSchedulerTest {

    private MutableClock clock;
    private InMemoryRewardTaskQueue queue;
    private RewardDispatcher dispatcher;
    private RewardTaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-10T10:00:00Z");
        queue = new InMemoryRewardTaskQueue(clock);
        dispatcher = mock(RewardDispatcher.class);
        scheduler = new RewardTaskScheduler(queue, dispatcher, new WasteEngineProperties(), clock);
        queue.enqueue(RewardTask.builder()
                .entryId("e1")
                .userId("u1")
                .category(WasteCategory.RECYCLABLE)
                .status(RewardTaskStatus.PENDING)
                .enqueuedAt(Timestamps.now(clock))
                .build());
    }

    @Test
    void recentTasksAreLeftToTheirWorker() {
        clock.advance(Duration.ofMinutes(1));

        scheduler.redrivePendingRewards();

        verify(dispatcher, never()).redrive(any());
    }

    @Test
    void stalePendingTasksAreRedriven() {
        clock.advance(Duration.ofMinutes(6));

        scheduler.redrivePendingRewards();

        ArgumentCaptor<RewardTask> captor = ArgumentCaptor.forClass(RewardTask.class);
        verify(dispatcher).redrive(captor.capture());
        assertThat(captor.getValue().getEntryId()).isEqualTo("e1");
    }
}
