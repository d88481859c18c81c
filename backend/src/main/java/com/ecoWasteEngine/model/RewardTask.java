package com.ecoWasteEngine.model;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.annotation.PropertyName;
import com.ecoWasteEngine.model.enums.RewardTaskStatus;
import com.ecoWasteEngine.model.enums.WasteCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Durable record of a reward application waiting to run (or already run). */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class RewardTask {
    @Getter(onMethod_ = @PropertyName("entry_id"))
    @Setter(onMethod_ = @PropertyName("entry_id"))
    private String entryId;

    @Getter(onMethod_ = @PropertyName("user_id"))
    @Setter(onMethod_ = @PropertyName("user_id"))
    private String userId;

    private WasteCategory category;

    private RewardTaskStatus status;

    private int attempts;

    @Getter(onMethod_ = @PropertyName("last_error"))
    @Setter(onMethod_ = @PropertyName("last_error"))
    private String lastError;

    @Getter(onMethod_ = @PropertyName("enqueued_at"))
    @Setter(onMethod_ = @PropertyName("enqueued_at"))
    private Timestamp enqueuedAt;

    @Getter(onMethod_ = @PropertyName("updated_at"))
    @Setter(onMethod_ = @PropertyName("updated_at"))
    private Timestamp updatedAt;
}
