package com.ecoWasteEngine.dto;

import com.ecoWasteEngine.model.enums.PickupStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PickupTransitionDTO {
    @NotNull(message = "Target status is required")
    @JsonProperty("to_status")
    private PickupStatus toStatus;

    /** Version the client last read */
    @NotNull(message = "Version is required")
    @PositiveOrZero(message = "Version cannot be negative")
    private Long version;

    /** Only for ASSIGNED */
    @JsonProperty("driver_id")
    private String driverId;

    private String reason;
}
