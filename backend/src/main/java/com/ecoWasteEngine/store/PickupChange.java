package com.ecoWasteEngine.store;

import com.ecoWasteEngine.model.enums.PickupStatus;
import com.google.cloud.Timestamp;
import lombok.Builder;
import lombok.Value;

/** One status write, as handed to {@link PickupStore#compareAndSwapStatus}. */
@Value
@Builder
public class PickupChange {
    PickupStatus newStatus;
    /** Driver attached after the write; null detaches */
    String assignedDriverId;
    String reason;
    String actor;
    Timestamp at;
}
