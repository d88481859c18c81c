package com.ecoWasteEngine.classifier;

import com.ecoWasteEngine.model.enums.WasteSubCategory;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deterministic stand-in for a model: the label and the score are derived from
 * the image hash, so the same bytes always classify the same way.
 */
public class StubWasteClassifier implements WasteClassifier {

    public static final String MODEL_NAME = "stub-waste-classifier";

    @Override
    public String modelName() {
        return MODEL_NAME;
    }

    @Override
    public ClassifierPrediction predict(byte[] image, String contentType) throws NoSuchAlgorithmException {
        byte[] digest = MessageDigest.getInstance("SHA-256").digest(image);
        WasteSubCategory[] labels = WasteSubCategory.values();
        WasteSubCategory label = labels[Byte.toUnsignedInt(digest[0]) % labels.length];
        // 0.35 .. 0.95, so every tier shows up
        double confidence = 0.35 + (Byte.toUnsignedInt(digest[1]) / 255.0) * 0.60;
        return ClassifierPrediction.builder()
                .category(label.getParent())
                .subCategory(label)
                .confidence(Math.round(confidence * 1000) / 1000.0)
                .modelName(MODEL_NAME)
                .build();
    }
}
