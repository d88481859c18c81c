package com.ecoWasteEngine.model;

import com.google.cloud.Timestamp;
import com.ecoWasteEngine.model.enums.WasteEntryStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EntryStatusChange {
    private WasteEntryStatus status;
    private Timestamp at;
}
