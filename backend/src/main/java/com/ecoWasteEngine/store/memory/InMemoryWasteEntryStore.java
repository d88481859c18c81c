package com.ecoWasteEngine.store.memory;

import com.ecoWasteEngine.exception.ResourceNotFoundException;
import com.ecoWasteEngine.model.Classification;
import com.ecoWasteEngine.model.EntryStatusChange;
import com.ecoWasteEngine.model.Timestamps;
import com.ecoWasteEngine.model.WasteEntry;
import com.ecoWasteEngine.model.enums.WasteEntryStatus;
import com.ecoWasteEngine.store.WasteEntryStore;
import com.google.cloud.Timestamp;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

@Component
@ConditionalOnProperty(name = "waste-engine.store", havingValue = "memory")
@RequiredArgsConstructor
public class InMemoryWasteEntryStore implements WasteEntryStore {

    private final ConcurrentMap<String, WasteEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    @Override
    public WasteEntry create(WasteEntry entry) {
        WasteEntry stored = copy(entry);
        if (entries.putIfAbsent(stored.getId(), stored) != null) {
            throw new IllegalStateException("Waste entry already exists: " + entry.getId());
        }
        return copy(stored);
    }

    @Override
    public Optional<WasteEntry> findById(String id) {
        return Optional.ofNullable(entries.get(id)).map(InMemoryWasteEntryStore::copy);
    }

    @Override
    public List<WasteEntry> findBySubmitter(String submitterId, int limit) {
        return entries.values().stream()
                .filter(e -> submitterId.equals(e.getSubmitterId()))
                .sorted(Comparator.comparing(WasteEntry::getCreatedAt).reversed())
                .limit(limit)
                .map(InMemoryWasteEntryStore::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<WasteEntry> findPendingCreatedBefore(Timestamp cutoff, int limit) {
        return entries.values().stream()
                .filter(e -> e.getStatus() == WasteEntryStatus.PENDING && e.getCreatedAt().compareTo(cutoff) < 0)
                .sorted(Comparator.comparing(WasteEntry::getCreatedAt))
                .limit(limit)
                .map(InMemoryWasteEntryStore::copy)
                .collect(Collectors.toList());
    }

    @Override
    public WasteEntry finalizeEntry(String id, WasteEntryStatus status, Classification classification) {
        if (!status.isFinal()) {
            throw new IllegalArgumentException("Not a final status: " + status);
        }
        WasteEntry updated = entries.computeIfPresent(id, (k, current) -> {
            if (current.getStatus().isFinal()) {
                throw new IllegalStateException("Waste entry " + id + " is already " + current.getStatus());
            }
            WasteEntry next = copy(current);
            next.setStatus(status);
            next.setClassification(classification);
            next.setFinalizedAt(Timestamps.now(clock));
            next.getStatusHistory().add(EntryStatusChange.builder()
                    .status(status)
                    .at(next.getFinalizedAt())
                    .build());
            return next;
        });
        if (updated == null) {
            throw new ResourceNotFoundException("Waste entry", id);
        }
        return copy(updated);
    }

    private static WasteEntry copy(WasteEntry entry) {
        return entry.toBuilder()
                .statusHistory(new ArrayList<>(entry.getStatusHistory()))
                .build();
    }
}
