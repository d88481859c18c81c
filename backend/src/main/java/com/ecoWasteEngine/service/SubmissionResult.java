package com.ecoWasteEngine.service;

import com.ecoWasteEngine.model.WasteEntry;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SubmissionResult {
    WasteEntry entry;
    /** true when an identical submission inside the dedup window was returned instead */
    boolean replayed;
    boolean rewardQueued;
}
