package com.ecoWasteEngine.store.memory;

import com.ecoWasteEngine.exception.PickupConflictException;
import com.ecoWasteEngine.exception.ResourceNotFoundException;
import com.ecoWasteEngine.model.Pickup;
import com.ecoWasteEngine.model.PickupStatusChange;
import com.ecoWasteEngine.model.enums.PickupStatus;
import com.ecoWasteEngine.store.PickupChange;
import com.ecoWasteEngine.store.PickupStore;
import com.google.cloud.Timestamp;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

@Component
@ConditionalOnProperty(name = "waste-engine.store", havingValue = "memory")
public class InMemoryPickupStore implements PickupStore {

    private final ConcurrentMap<String, Pickup> pickups = new ConcurrentHashMap<>();

    @Override
    public Pickup create(Pickup pickup) {
        Pickup stored = copy(pickup);
        if (pickups.putIfAbsent(stored.getId(), stored) != null) {
            throw new IllegalStateException("Pickup already exists: " + pickup.getId());
        }
        return copy(stored);
    }

    @Override
    public Optional<Pickup> findById(String id) {
        return Optional.ofNullable(pickups.get(id)).map(InMemoryPickupStore::copy);
    }

    @Override
    public List<Pickup> findActiveByEntry(String wasteEntryId) {
        return pickups.values().stream()
                .filter(p -> wasteEntryId.equals(p.getWasteEntryId()))
                .filter(p -> !p.getStatus().isTerminal())
                .map(InMemoryPickupStore::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<Pickup> findByStatus(PickupStatus status, int limit) {
        return pickups.values().stream()
                .filter(p -> p.getStatus() == status)
                .sorted(Comparator.comparing(Pickup::getCreatedAt))
                .limit(limit)
                .map(InMemoryPickupStore::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<Pickup> findByStatusCreatedBefore(PickupStatus status, Timestamp cutoff) {
        return pickups.values().stream()
                .filter(p -> p.getStatus() == status)
                .filter(p -> p.getCreatedAt().compareTo(cutoff) < 0)
                .sorted(Comparator.comparing(Pickup::getCreatedAt))
                .map(InMemoryPickupStore::copy)
                .collect(Collectors.toList());
    }

    @Override
    public Pickup compareAndSwapStatus(String id, long expectedVersion, PickupChange change) {
        Pickup updated = pickups.computeIfPresent(id, (k, current) -> {
            if (current.getVersion() != expectedVersion) {
                throw new PickupConflictException(id, expectedVersion, current.getVersion());
            }
            Pickup next = copy(current);
            next.setStatus(change.getNewStatus());
            next.setAssignedDriverId(change.getAssignedDriverId());
            if (change.getReason() != null) {
                next.setReason(change.getReason());
            }
            next.setVersion(current.getVersion() + 1);
            next.setUpdatedAt(change.getAt());
            next.getHistory().add(PickupStatusChange.builder()
                    .from(current.getStatus())
                    .to(change.getNewStatus())
                    .actor(change.getActor())
                    .version(next.getVersion())
                    .at(change.getAt())
                    .build());
            return next;
        });
        if (updated == null) {
            throw new ResourceNotFoundException("Pickup", id);
        }
        return copy(updated);
    }

    private static Pickup copy(Pickup pickup) {
        return pickup.toBuilder()
                .history(new ArrayList<>(pickup.getHistory()))
                .build();
    }
}
