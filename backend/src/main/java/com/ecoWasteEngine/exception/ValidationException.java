package com.ecoWasteEngine.exception;

/** Bad input. Thrown before any side effect happens. */
public class ValidationException extends RuntimeException {

    private final boolean payloadTooLarge;

    public ValidationException(String message) {
        this(message, false);
    }

    private ValidationException(String message, boolean payloadTooLarge) {
        super(message);
        this.payloadTooLarge = payloadTooLarge;
    }

    public static ValidationException payloadTooLarge(long size, long max) {
        return new ValidationException("Image is " + size + " bytes, the limit is " + max + " bytes", true);
    }

    public boolean isPayloadTooLarge() {
        return payloadTooLarge;
    }
}
