package com.ecoWasteEngine.model.enums;

public enum ConfidenceTier {
    HIGH,
    MEDIUM,
    LOW
}
