package com.ecoWasteEngine.scheduler;

import com.ecoWasteEngine.service.PickupStateMachine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class PickupTimeoutScheduler {

    private final PickupStateMachine pickupStateMachine;

    /** Hourly: cancel pickups nobody was assigned to in time */
    @Scheduled(cron = "${waste-engine.pickup.timeout-cron:0 0 * * * *}")
    public void cancelExpiredPickups() {
        log.info("[Scheduler] Checking for expired pickup requests");
        int cancelled = pickupStateMachine.cancelExpired();
        if (cancelled > 0) {
            log.info("[Scheduler] Cancelled {} expired pickup request(s)", cancelled);
        }
    }
}
