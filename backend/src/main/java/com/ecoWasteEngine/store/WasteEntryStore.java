package com.ecoWasteEngine.store;

import com.google.cloud.Timestamp;
import com.ecoWasteEngine.model.Classification;
import com.ecoWasteEngine.model.WasteEntry;
import com.ecoWasteEngine.model.enums.WasteEntryStatus;

import java.util.List;
import java.util.Optional;

public interface WasteEntryStore {

    /** Inserts a PENDING entry; the id is assigned by the caller. */
    WasteEntry create(WasteEntry entry);

    Optional<WasteEntry> findById(String id);

    /** Newest first */
    List<WasteEntry> findBySubmitter(String submitterId, int limit);

    /** PENDING entries created before the cutoff, oldest first */
    List<WasteEntry> findPendingCreatedBefore(Timestamp cutoff, int limit);

    /**
     * Moves a PENDING entry to CLASSIFIED or UNCLASSIFIED. The write only
     * happens while the stored status is still PENDING.
     *
     * @throws IllegalStateException if the entry is already final
     */
    WasteEntry finalizeEntry(String id, WasteEntryStatus status, Classification classification);
}
