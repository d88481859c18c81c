package com.ecoWasteEngine.model.enums;

public enum RewardTaskStatus {
    PENDING,
    COMPLETED,
    ABANDONED
}
