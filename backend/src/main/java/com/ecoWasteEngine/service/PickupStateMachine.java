package com.ecoWasteEngine.service;

import com.ecoWasteEngine.config.WasteEngineProperties;
import com.ecoWasteEngine.exception.InvalidTransitionException;
import com.ecoWasteEngine.exception.PickupConflictException;
import com.ecoWasteEngine.exception.ResourceNotFoundException;
import com.ecoWasteEngine.exception.ValidationException;
import com.ecoWasteEngine.model.Pickup;
import com.ecoWasteEngine.model.PickupStatusChange;
import com.ecoWasteEngine.model.Timestamps;
import com.ecoWasteEngine.model.WasteEntry;
import com.ecoWasteEngine.model.enums.PickupStatus;
import com.ecoWasteEngine.model.enums.WasteEntryStatus;
import com.ecoWasteEngine.store.PickupChange;
import com.ecoWasteEngine.store.PickupStore;
import com.ecoWasteEngine.store.WasteEntryStore;
import com.google.cloud.Timestamp;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Pickup lifecycle with optimistic concurrency. Every transition names the
 * version the caller last saw; a stale version is rejected before anything
 * else is checked.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PickupStateMachine {

    public static final String SYSTEM_ACTOR = "system";

    private final PickupStore pickupStore;
    private final WasteEntryStore entryStore;
    private final WasteEngineProperties properties;
    private final Clock clock;

    public Pickup requestPickup(String userId, String wasteEntryId, String address,
            LocalDate scheduledDate, boolean manualHandling) {
        WasteEntry entry = entryStore.findById(wasteEntryId)
                .orElseThrow(() -> new ResourceNotFoundException("Waste entry", wasteEntryId));
        if (!entry.getSubmitterId().equals(userId)) {
            throw new AccessDeniedException("Only the submitter can request a pickup for entry " + wasteEntryId);
        }
        if (entry.getStatus() == WasteEntryStatus.PENDING) {
            throw new InvalidTransitionException("Entry " + wasteEntryId + " is not finalized yet");
        }
        boolean manual = manualHandling;
        if (entry.getStatus() == WasteEntryStatus.UNCLASSIFIED && !manualHandling) {
            throw new ValidationException("Unclassified entries can only be picked up with manual handling");
        }
        if (entry.getClassification() != null && entry.getClassification().isManualReviewRequired()) {
            manual = true;
        }
        if (address == null || address.isBlank()) {
            throw new ValidationException("Pickup address is required");
        }
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        if (scheduledDate != null && scheduledDate.isBefore(today)) {
            throw new ValidationException("Scheduled date " + scheduledDate + " is in the past");
        }
        if (!pickupStore.findActiveByEntry(wasteEntryId).isEmpty()) {
            throw new InvalidTransitionException("Entry " + wasteEntryId + " already has an active pickup");
        }

        Timestamp now = Timestamps.now(clock);
        List<PickupStatusChange> history = new ArrayList<>();
        history.add(PickupStatusChange.builder()
                .to(PickupStatus.REQUESTED)
                .actor(userId)
                .version(0)
                .at(now)
                .build());
        Pickup created = pickupStore.create(Pickup.builder()
                .id(UUID.randomUUID().toString())
                .wasteEntryId(wasteEntryId)
                .userId(userId)
                .address(address.trim())
                .status(PickupStatus.REQUESTED)
                .version(0)
                .manualHandling(manual)
                .scheduledDate(scheduledDate != null ? scheduledDate.toString() : null)
                .createdAt(now)
                .updatedAt(now)
                .history(history)
                .build());
        log.info("[Pickup] {} requested by {} for entry {}", created.getId(), userId, wasteEntryId);
        return created;
    }

    /**
     * Moves a pickup along one edge of the state graph.
     *
     * @param driverId required when assigning, ignored otherwise
     * @throws PickupConflictException if {@code expectedVersion} is stale
     * @throws InvalidTransitionException if the edge is not in the graph
     */
    public Pickup transition(String pickupId, PickupStatus target, long expectedVersion,
            String actorId, String driverId, String reason) {
        Pickup current = get(pickupId);
        if (current.getVersion() != expectedVersion) {
            throw new PickupConflictException(pickupId, expectedVersion, current.getVersion());
        }
        if (!current.getStatus().canTransitionTo(target)) {
            throw new InvalidTransitionException(
                    "Pickup " + pickupId + " cannot move from " + current.getStatus() + " to " + target);
        }

        String nextDriver = current.getAssignedDriverId();
        if (target == PickupStatus.ASSIGNED) {
            if (driverId == null || driverId.isBlank()) {
                throw new ValidationException("A driver is required to assign a pickup");
            }
            nextDriver = driverId;
        } else if (target == PickupStatus.REQUESTED) {
            nextDriver = null;
        }
        if (target.isDriverStep() && !isActor(actorId, current.getAssignedDriverId())) {
            throw new AccessDeniedException("Only the assigned driver can mark pickup " + pickupId + " " + target);
        }
        if (target == PickupStatus.CANCELLED
                && !isActor(actorId, current.getUserId()) && !SYSTEM_ACTOR.equals(actorId)) {
            throw new AccessDeniedException("Only the requester can cancel pickup " + pickupId);
        }
        if (target == PickupStatus.FAILED && (reason == null || reason.isBlank())) {
            throw new ValidationException("A reason is required to fail a pickup");
        }

        Pickup updated = pickupStore.compareAndSwapStatus(pickupId, expectedVersion, PickupChange.builder()
                .newStatus(target)
                .assignedDriverId(nextDriver)
                .reason(reason)
                .actor(actorId)
                .at(Timestamps.now(clock))
                .build());
        log.info("[Pickup] {} {} -> {} by {} (version {})",
                pickupId, current.getStatus(), target, actorId, updated.getVersion());
        return updated;
    }

    // an anonymous caller never matches, even a pickup with no driver yet
    private static boolean isActor(String actorId, String expected) {
        return actorId != null && actorId.equals(expected);
    }

    public Pickup get(String pickupId) {
        return pickupStore.findById(pickupId)
                .orElseThrow(() -> new ResourceNotFoundException("Pickup", pickupId));
    }

    public List<Pickup> listByStatus(PickupStatus status, int limit) {
        return pickupStore.findByStatus(status, limit);
    }

    /**
     * Cancels REQUESTED pickups nobody picked up within the request timeout.
     * A pickup that is concurrently assigned is left alone.
     *
     * @return number of pickups cancelled
     */
    public int cancelExpired() {
        Timestamp cutoff = Timestamps.of(clock.instant().minus(properties.getPickup().getRequestTimeout()));
        int cancelled = 0;
        for (Pickup stale : pickupStore.findByStatusCreatedBefore(PickupStatus.REQUESTED, cutoff)) {
            if (cancelWithRetry(stale.getId())) {
                cancelled++;
            }
        }
        return cancelled;
    }

    private boolean cancelWithRetry(String pickupId) {
        int maxAttempts = properties.getPickup().getTimeoutMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Pickup current = get(pickupId);
            if (current.getStatus() != PickupStatus.REQUESTED) {
                return false;
            }
            try {
                transition(pickupId, PickupStatus.CANCELLED, current.getVersion(),
                        SYSTEM_ACTOR, null, "Not assigned within " + properties.getPickup().getRequestTimeout());
                return true;
            } catch (PickupConflictException e) {
                log.debug("[Pickup] Timeout cancel of {} lost a race (attempt {}/{})", pickupId, attempt, maxAttempts);
            }
        }
        log.warn("[Pickup] Gave up cancelling expired pickup {} after {} attempts", pickupId, maxAttempts);
        return false;
    }
}
