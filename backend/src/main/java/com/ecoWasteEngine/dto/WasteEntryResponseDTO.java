package com.ecoWasteEngine.dto;

import com.ecoWasteEngine.model.WasteEntry;
import com.ecoWasteEngine.model.enums.WasteEntryStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WasteEntryResponseDTO {
    private String id;

    @JsonProperty("submitter_id")
    private String submitterId;

    private WasteEntryStatus status;

    @JsonProperty("image_ref")
    private String imageRef;

    private ClassificationDTO classification;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("finalized_at")
    private String finalizedAt;

    @JsonProperty("status_history")
    private List<StatusChange> statusHistory;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StatusChange {
        private WasteEntryStatus status;
        private String at;
    }

    public static WasteEntryResponseDTO fromModel(WasteEntry entry) {
        if (entry == null)
            return null;
        return WasteEntryResponseDTO.builder()
                .id(entry.getId())
                .submitterId(entry.getSubmitterId())
                .status(entry.getStatus())
                .imageRef(entry.getImageRef())
                .classification(ClassificationDTO.fromModel(entry.getClassification()))
                .createdAt(DtoTimes.format(entry.getCreatedAt()))
                .finalizedAt(DtoTimes.format(entry.getFinalizedAt()))
                .statusHistory(entry.getStatusHistory().stream()
                        .map(c -> new StatusChange(c.getStatus(), DtoTimes.format(c.getAt())))
                        .collect(Collectors.toList()))
                .build();
    }
}
