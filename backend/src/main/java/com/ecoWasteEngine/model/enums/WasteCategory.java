package com.ecoWasteEngine.model.enums;

public enum WasteCategory {
    ORGANIC,
    RECYCLABLE,
    HAZARDOUS,
    ELECTRONIC,
    GENERAL,
    MEDICAL
}
