package com.ecoWasteEngine.exception;

public class RewardComputationException extends RuntimeException {

    public RewardComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
