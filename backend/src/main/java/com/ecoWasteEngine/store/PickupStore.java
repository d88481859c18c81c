package com.ecoWasteEngine.store;

import com.ecoWasteEngine.model.Pickup;
import com.ecoWasteEngine.model.enums.PickupStatus;
import com.google.cloud.Timestamp;

import java.util.List;
import java.util.Optional;

public interface PickupStore {

    Pickup create(Pickup pickup);

    Optional<Pickup> findById(String id);

    /** Pickups for the entry that are not yet COLLECTED, CANCELLED or FAILED */
    List<Pickup> findActiveByEntry(String wasteEntryId);

    /** Oldest first */
    List<Pickup> findByStatus(PickupStatus status, int limit);

    List<Pickup> findByStatusCreatedBefore(PickupStatus status, Timestamp cutoff);

    /**
     * Applies {@code change} only if the stored version equals
     * {@code expectedVersion}; the stored version is then incremented.
     *
     * @throws com.ecoWasteEngine.exception.PickupConflictException on a version mismatch
     * @throws com.ecoWasteEngine.exception.ResourceNotFoundException if the pickup does not exist
     */
    Pickup compareAndSwapStatus(String id, long expectedVersion, PickupChange change);
}
