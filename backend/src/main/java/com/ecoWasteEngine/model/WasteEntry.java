package com.ecoWasteEngine.model;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.annotation.PropertyName;
import com.ecoWasteEngine.model.enums.WasteEntryStatus;
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
public class WasteEntry {
    private String id;

    @Getter(onMethod_ = @PropertyName("submitter_id"))
    @Setter(onMethod_ = @PropertyName("submitter_id"))
    private String submitterId;

    private String fingerprint;

    @Getter(onMethod_ = @PropertyName("image_ref"))
    @Setter(onMethod_ = @PropertyName("image_ref"))
    private String imageRef;

    @Getter(onMethod_ = @PropertyName("content_type"))
    @Setter(onMethod_ = @PropertyName("content_type"))
    private String contentType;

    private WasteEntryStatus status;

    private Classification classification;

    @Getter(onMethod_ = @PropertyName("created_at"))
    @Setter(onMethod_ = @PropertyName("created_at"))
    private Timestamp createdAt;

    @Getter(onMethod_ = @PropertyName("finalized_at"))
    @Setter(onMethod_ = @PropertyName("finalized_at"))
    private Timestamp finalizedAt;

    @Builder.Default
    @Getter(onMethod_ = @PropertyName("status_history"))
    @Setter(onMethod_ = @PropertyName("status_history"))
    private List<EntryStatusChange> statusHistory = new ArrayList<>();
}
