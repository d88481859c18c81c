package com.ecoWasteEngine.dto;

import com.ecoWasteEngine.model.Pickup;
import com.ecoWasteEngine.model.enums.PickupStatus;
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
public class PickupResponseDTO {
    private String id;

    @JsonProperty("waste_entry_id")
    private String wasteEntryId;

    @JsonProperty("user_id")
    private String userId;

    private String address;
    private PickupStatus status;

    @JsonProperty("assigned_driver_id")
    private String assignedDriverId;

    private long version;

    @JsonProperty("manual_handling")
    private boolean manualHandling;

    @JsonProperty("scheduled_date")
    private String scheduledDate;

    private String reason;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("updated_at")
    private String updatedAt;

    private List<Transition> history;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Transition {
        private PickupStatus from;
        private PickupStatus to;
        private String actor;
        private long version;
        private String at;
    }

    public static PickupResponseDTO fromModel(Pickup pickup) {
        if (pickup == null)
            return null;
        return PickupResponseDTO.builder()
                .id(pickup.getId())
                .wasteEntryId(pickup.getWasteEntryId())
                .userId(pickup.getUserId())
                .address(pickup.getAddress())
                .status(pickup.getStatus())
                .assignedDriverId(pickup.getAssignedDriverId())
                .version(pickup.getVersion())
                .manualHandling(pickup.isManualHandling())
                .scheduledDate(pickup.getScheduledDate())
                .reason(pickup.getReason())
                .createdAt(DtoTimes.format(pickup.getCreatedAt()))
                .updatedAt(DtoTimes.format(pickup.getUpdatedAt()))
                .history(pickup.getHistory().stream()
                        .map(h -> new Transition(h.getFrom(), h.getTo(), h.getActor(), h.getVersion(),
                                DtoTimes.format(h.getAt())))
                        .collect(Collectors.toList()))
                .build();
    }
}
