package com.ecoWasteEngine.policy;

import com.ecoWasteEngine.config.WasteEngineProperties;
import com.ecoWasteEngine.model.enums.BinType;
import com.ecoWasteEngine.model.enums.ConfidenceTier;
import com.ecoWasteEngine.model.enums.WasteCategory;
import com.ecoWasteEngine.model.enums.WasteSubCategory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps a classifier score to a tier and a disposal decision. Pure: no I/O, no
 * clock, same input gives the same output.
 *
 * <ul>
 * <li>score &ge; high threshold: HIGH, bin and instructions</li>
 * <li>score &ge; medium threshold: MEDIUM, bin and instructions plus a check step</li>
 * <li>otherwise: LOW, no bin, manual review</li>
 * </ul>
 */
@Component
public class ConfidencePolicyEngine {

    static final String VERIFY_STEP = "Check the item against the bin label before disposing of it.";
    static final String MANUAL_STEP = "Do not dispose of this item yet; hand it to staff for manual sorting.";

    private final double highThreshold;
    private final double mediumThreshold;

    @Autowired
    public ConfidencePolicyEngine(WasteEngineProperties properties) {
        this(properties.getPolicy().getHighThreshold(), properties.getPolicy().getMediumThreshold());
    }

    public ConfidencePolicyEngine(double highThreshold, double mediumThreshold) {
        if (!(0.0 <= mediumThreshold && mediumThreshold < highThreshold && highThreshold <= 1.0)) {
            throw new IllegalArgumentException(
                    "Thresholds must satisfy 0 <= medium < high <= 1, got " + mediumThreshold + " / " + highThreshold);
        }
        this.highThreshold = highThreshold;
        this.mediumThreshold = mediumThreshold;
    }

    public ConfidenceTier tierFor(double score) {
        if (score >= highThreshold) {
            return ConfidenceTier.HIGH;
        }
        if (score >= mediumThreshold) {
            return ConfidenceTier.MEDIUM;
        }
        return ConfidenceTier.LOW;
    }

    public DisposalDecision decide(double score, WasteCategory category, WasteSubCategory subCategory) {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score out of range: " + score);
        }
        ConfidenceTier tier = tierFor(score);
        if (tier == ConfidenceTier.LOW) {
            return DisposalDecision.builder()
                    .tier(tier)
                    .recommendedBin(null)
                    .instructions(List.of(MANUAL_STEP))
                    .manualReviewRequired(true)
                    .build();
        }

        BinType bin = DisposalGuide.binFor(category, subCategory);
        List<String> instructions = new ArrayList<>(DisposalGuide.instructionsFor(category, subCategory));
        instructions.add("Place the item in the " + bin.toLabel() + ".");
        if (tier == ConfidenceTier.MEDIUM) {
            instructions.add(0, VERIFY_STEP);
        }
        return DisposalDecision.builder()
                .tier(tier)
                .recommendedBin(bin)
                .instructions(List.copyOf(instructions))
                .manualReviewRequired(false)
                .build();
    }
}
