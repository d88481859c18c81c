package com.ecoWasteEngine.model;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.annotation.PropertyName;
import com.ecoWasteEngine.model.enums.PickupStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Pickup {
    private String id;

    @Getter(onMethod_ = @PropertyName("waste_entry_id"))
    @Setter(onMethod_ = @PropertyName("waste_entry_id"))
    private String wasteEntryId;

    @Getter(onMethod_ = @PropertyName("user_id"))
    @Setter(onMethod_ = @PropertyName("user_id"))
    private String userId;

    private String address;

    private PickupStatus status;

    @Getter(onMethod_ = @PropertyName("assigned_driver_id"))
    @Setter(onMethod_ = @PropertyName("assigned_driver_id"))
    private String assignedDriverId;

    /** Incremented on every transition, compared on every write */
    private long version;

    @Getter(onMethod_ = @PropertyName("manual_handling"))
    @Setter(onMethod_ = @PropertyName("manual_handling"))
    private boolean manualHandling;

    /** ISO date (yyyy-MM-dd) */
    @Getter(onMethod_ = @PropertyName("scheduled_date"))
    @Setter(onMethod_ = @PropertyName("scheduled_date"))
    private String scheduledDate;

    /** Reason given for CANCELLED / FAILED */
    private String reason;

    @Getter(onMethod_ = @PropertyName("created_at"))
    @Setter(onMethod_ = @PropertyName("created_at"))
    private Timestamp createdAt;

    @Getter(onMethod_ = @PropertyName("updated_at"))
    @Setter(onMethod_ = @PropertyName("updated_at"))
    private Timestamp updatedAt;

    @Builder.Default
    private List<PickupStatusChange> history = new ArrayList<>();
}
