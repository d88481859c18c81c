package com.ecoWasteEngine.model.enums;

public enum WasteEntryStatus {
    PENDING,
    CLASSIFIED,
    UNCLASSIFIED;

    public boolean isFinal() {
        return this != PENDING;
    }
}
