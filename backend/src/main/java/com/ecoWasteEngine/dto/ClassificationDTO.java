package com.ecoWasteEngine.dto;

import com.ecoWasteEngine.model.Classification;
import com.ecoWasteEngine.model.enums.BinType;
import com.ecoWasteEngine.model.enums.ConfidenceTier;
import com.ecoWasteEngine.model.enums.WasteCategory;
import com.ecoWasteEngine.model.enums.WasteSubCategory;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClassificationDTO {
    private WasteCategory category;

    @JsonProperty("sub_category")
    private WasteSubCategory subCategory;

    private Double confidence;

    @JsonProperty("confidence_tier")
    private ConfidenceTier confidenceTier;

    @JsonProperty("recommended_bin")
    private BinType recommendedBin;

    @JsonProperty("handling_instructions")
    private List<String> handlingInstructions;

    @JsonProperty("manual_review")
    private boolean manualReview;

    @JsonProperty("model_name")
    private String modelName;

    public static ClassificationDTO fromModel(Classification c) {
        if (c == null)
            return null;
        return ClassificationDTO.builder()
                .category(c.getCategory())
                .subCategory(c.getSubCategory())
                .confidence(c.getConfidence())
                .confidenceTier(c.getConfidenceTier())
                .recommendedBin(c.getRecommendedBin())
                .handlingInstructions(c.getHandlingInstructions())
                .manualReview(c.isManualReviewRequired())
                .modelName(c.getModelName())
                .build();
    }
}
