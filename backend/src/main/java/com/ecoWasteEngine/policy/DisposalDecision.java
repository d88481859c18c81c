package com.ecoWasteEngine.policy;

import com.ecoWasteEngine.model.enums.BinType;
import com.ecoWasteEngine.model.enums.ConfidenceTier;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DisposalDecision {
    ConfidenceTier tier;
    /** null for LOW */
    BinType recommendedBin;
    List<String> instructions;
    boolean manualReviewRequired;
}
