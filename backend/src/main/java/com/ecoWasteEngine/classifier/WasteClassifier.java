package com.ecoWasteEngine.classifier;

/** One classifier variant. Implementations may block and may throw anything. */
public interface WasteClassifier {

    String modelName();

    ClassifierPrediction predict(byte[] image, String contentType) throws Exception;
}
