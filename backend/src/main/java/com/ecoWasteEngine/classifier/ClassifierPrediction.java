package com.ecoWasteEngine.classifier;

import com.ecoWasteEngine.model.enums.WasteCategory;
import com.ecoWasteEngine.model.enums.WasteSubCategory;
import lombok.Builder;
import lombok.Value;

import java.util.Locale;

@Value
@Builder
public class ClassifierPrediction {
    WasteCategory category;
    WasteSubCategory subCategory;
    double confidence;
    String modelName;

    /**
     * Builds a prediction from the classifier's wire labels. The category label
     * may name a sub-category ("plastic"), which then implies its parent.
     *
     * @throws IllegalArgumentException for an unknown label or a confidence outside [0, 1]
     */
    public static ClassifierPrediction fromLabels(String categoryLabel, String subCategoryLabel,
            double confidence, String modelName) {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence out of range: " + confidence);
        }
        if (categoryLabel == null || categoryLabel.isBlank()) {
            throw new IllegalArgumentException("Missing category label");
        }
        String normalized = normalize(categoryLabel);
        WasteSubCategory subCategory = subCategoryLabel == null || subCategoryLabel.isBlank()
                ? null
                : WasteSubCategory.valueOf(normalize(subCategoryLabel));

        WasteCategory category;
        if (isCategory(normalized)) {
            category = WasteCategory.valueOf(normalized);
        } else {
            WasteSubCategory implied = WasteSubCategory.valueOf(normalized);
            category = implied.getParent();
            if (subCategory == null) {
                subCategory = implied;
            }
        }
        if (subCategory != null && subCategory.getParent() != category) {
            throw new IllegalArgumentException(subCategory + " is not a kind of " + category);
        }
        return ClassifierPrediction.builder()
                .category(category)
                .subCategory(subCategory)
                .confidence(confidence)
                .modelName(modelName)
                .build();
    }

    private static boolean isCategory(String label) {
        for (WasteCategory c : WasteCategory.values()) {
            if (c.name().equals(label)) {
                return true;
            }
        }
        return false;
    }

    private static String normalize(String label) {
        return label.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    }
}
