package com.ecoWasteEngine.scheduler;

import com.ecoWasteEngine.config.WasteEngineProperties;
import com.ecoWasteEngine.model.Timestamps;
import com.ecoWasteEngine.model.WasteEntry;
import com.ecoWasteEngine.service.IngestionOrchestrator;
import com.ecoWasteEngine.service.SubmissionResult;
import com.ecoWasteEngine.store.WasteEntryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/** Finishes entries whose finalization failed after the PENDING insert. */
@Component
@Slf4j
@RequiredArgsConstructor
public class PendingEntryScheduler {

    private final WasteEntryStore entryStore;
    private final IngestionOrchestrator ingestionOrchestrator;
    private final WasteEngineProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${waste-engine.ingestion.pending-redrive-interval:PT2M}")
    public void resumeStalePendingEntries() {
        WasteEngineProperties.Ingestion config = properties.getIngestion();
        List<WasteEntry> stale = entryStore.findPendingCreatedBefore(
                Timestamps.of(clock.instant().minus(config.getPendingRedriveAfter())),
                config.getPendingRedriveBatch());
        if (stale.isEmpty()) {
            return;
        }
        log.info("[Scheduler] Resuming {} pending waste entr{}", stale.size(), stale.size() == 1 ? "y" : "ies");
        int finished = 0;
        for (WasteEntry entry : stale) {
            SubmissionResult result = ingestionOrchestrator.resumePending(entry);
            if (result.getEntry().getStatus().isFinal()) {
                finished++;
            }
        }
        log.info("[Scheduler] {} of {} pending entries finalized", finished, stale.size());
    }
}
