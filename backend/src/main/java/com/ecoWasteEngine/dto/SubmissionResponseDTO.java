package com.ecoWasteEngine.dto;

import com.ecoWasteEngine.model.WasteEntry;
import com.ecoWasteEngine.model.enums.WasteEntryStatus;
import com.ecoWasteEngine.service.SubmissionResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SubmissionResponseDTO {
    @JsonProperty("entry_id")
    private String entryId;

    private WasteEntryStatus status;

    /** null unless the entry is CLASSIFIED */
    private ClassificationDTO classification;

    private boolean replayed;

    @JsonProperty("reward_queued")
    private boolean rewardQueued;

    @JsonProperty("created_at")
    private String createdAt;

    public static SubmissionResponseDTO fromResult(SubmissionResult result) {
        WasteEntry entry = result.getEntry();
        return SubmissionResponseDTO.builder()
                .entryId(entry.getId())
                .status(entry.getStatus())
                .classification(ClassificationDTO.fromModel(entry.getClassification()))
                .replayed(result.isReplayed())
                .rewardQueued(result.isRewardQueued())
                .createdAt(DtoTimes.format(entry.getCreatedAt()))
                .build();
    }
}
