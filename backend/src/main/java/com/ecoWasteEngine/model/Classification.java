package com.ecoWasteEngine.model;

import com.google.cloud.firestore.annotation.PropertyName;
import com.ecoWasteEngine.model.enums.BinType;
import com.ecoWasteEngine.model.enums.ConfidenceTier;
import com.ecoWasteEngine.model.enums.WasteCategory;
import com.ecoWasteEngine.model.enums.WasteSubCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Classification of one waste entry. Written once, together with the
 * CLASSIFIED status, and never updated afterwards.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Classification {
    private WasteCategory category;

    @Getter(onMethod_ = @PropertyName("sub_category"))
    @Setter(onMethod_ = @PropertyName("sub_category"))
    private WasteSubCategory subCategory;

    private Double confidence;

    @Getter(onMethod_ = @PropertyName("confidence_tier"))
    @Setter(onMethod_ = @PropertyName("confidence_tier"))
    private ConfidenceTier confidenceTier;

    /** null when the tier is LOW */
    @Getter(onMethod_ = @PropertyName("recommended_bin"))
    @Setter(onMethod_ = @PropertyName("recommended_bin"))
    private BinType recommendedBin;

    @Builder.Default
    @Getter(onMethod_ = @PropertyName("handling_instructions"))
    @Setter(onMethod_ = @PropertyName("handling_instructions"))
    private List<String> handlingInstructions = new ArrayList<>();

    @Getter(onMethod_ = @PropertyName("manual_review_required"))
    @Setter(onMethod_ = @PropertyName("manual_review_required"))
    private boolean manualReviewRequired;

    @Getter(onMethod_ = @PropertyName("model_name"))
    @Setter(onMethod_ = @PropertyName("model_name"))
    private String modelName;
}
