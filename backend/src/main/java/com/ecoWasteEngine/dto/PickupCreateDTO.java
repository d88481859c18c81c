package com.ecoWasteEngine.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PickupCreateDTO {
    @NotBlank(message = "Waste entry ID is required")
    @JsonProperty("waste_entry_id")
    @JsonAlias("entry_id")
    private String wasteEntryId;

    @NotBlank(message = "Address is required")
    @Size(max = 500, message = "Address must be at most 500 characters")
    private String address;

    @JsonProperty("scheduled_date")
    private LocalDate scheduledDate;

    @JsonProperty("manual_handling")
    private boolean manualHandling;
}
