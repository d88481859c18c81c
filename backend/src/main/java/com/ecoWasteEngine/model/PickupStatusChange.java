package com.ecoWasteEngine.model;

import com.google.cloud.Timestamp;
import com.ecoWasteEngine.model.enums.PickupStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PickupStatusChange {
    private PickupStatus from;
    private PickupStatus to;
    private String actor;
    private long version;
    private Timestamp at;
}
