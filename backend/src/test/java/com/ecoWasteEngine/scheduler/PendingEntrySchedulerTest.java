package com.ecoWasteEngine.scheduler;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ecoWasteEngine.config.WasteEngineProperties;
import com.ecoWasteEngine.model.Timestamps;
import com.ecoWasteEngine.model.WasteEntry;
import com.ecoWasteEngine.model.enums.WasteEntryStatus;
import com.ecoWasteEngine.service.IngestionOrchestrator;
import com.ecoWasteEngine.service.SubmissionResult;
import com.ecoWasteEngine.store.memory.InMemoryWasteEntryStore;
import com.ecoWasteEngine.support.MutableClock;
import java.time.Duration;
import java.util.ArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PendingEntrySchedulerTest {

    private MutableClock clock;
    private InMemoryWasteEntryStore entries;
    private IngestionOrchestrator orchestrator;
    private PendingEntryScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-10T10:00:00Z");
        entries = new InMemoryWasteEntryStore(clock);
        orchestrator = mock(IngestionOrchestrator.class);
        when(orchestrator.resumePending(any())).thenAnswer(inv -> SubmissionResult.builder()
                .entry(((WasteEntry) inv.getArgument(0)).toBuilder().status(WasteEntryStatus.UNCLASSIFIED).build())
                .build());
        scheduler = new PendingEntryScheduler(entries, orchestrator, new WasteEngineProperties(), clock);
        entries.create(WasteEntry.builder()
                .id("e1")
                .submitterId("u1")
                .imageRef("mem://e1")
                .contentType("image/jpeg")
                .status(WasteEntryStatus.PENDING)
                .createdAt(Timestamps.now(clock))
                .statusHistory(new ArrayList<>())
                .build());
    }

    @Test
    void freshPendingEntriesAreLeftToTheirRequest() {
        clock.advance(Duration.ofMinutes(1));

        scheduler.resumeStalePendingEntries();

        verify(orchestrator, never()).resumePending(any());
    }

    @Test
    void stalePendingEntriesAreResumed() {
        clock.advance(Duration.ofMinutes(6));

        scheduler.resumeStalePendingEntries();

        verify(orchestrator).resumePending(argThat(e -> "e1".equals(e.getId())));
    }
}
