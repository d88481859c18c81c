package com.ecoWasteEngine.scheduler;

import com.ecoWasteEngine.config.WasteEngineProperties;
import com.ecoWasteEngine.model.RewardTask;
import com.ecoWasteEngine.model.Timestamps;
import com.ecoWasteEngine.service.RewardDispatcher;
import com.ecoWasteEngine.store.RewardTaskQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/** Picks up reward tasks that stayed PENDING, e.g. after a restart. */
@Component
@Slf4j
@RequiredArgsConstructor
public class RewardTaskScheduler {

    private final RewardTaskQueue taskQueue;
    private final RewardDispatcher rewardDispatcher;
    private final WasteEngineProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${waste-engine.rewards.redrive-interval:PT1M}")
    public void redrivePendingRewards() {
        List<RewardTask> stale = taskQueue.findPendingEnqueuedBefore(
                Timestamps.of(clock.instant().minus(properties.getRewards().getRedriveAfter())));
        if (stale.isEmpty()) {
            return;
        }
        log.info("[Scheduler] Re-driving {} pending reward task(s)", stale.size());
        for (RewardTask task : stale) {
            rewardDispatcher.redrive(task);
        }
    }
}
