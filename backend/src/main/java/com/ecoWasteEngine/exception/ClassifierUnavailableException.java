package com.ecoWasteEngine.exception;

/** Any classifier failure, timeout included. Never fails an upload. */
public class ClassifierUnavailableException extends RuntimeException {

    private final boolean timedOut;

    public ClassifierUnavailableException(String message, Throwable cause, boolean timedOut) {
        super(message, cause);
        this.timedOut = timedOut;
    }

    public ClassifierUnavailableException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
