package com.ecoWasteEngine.exception;

/** Store or infrastructure failure the caller cannot fix */
public class ServiceException extends RuntimeException {

    public ServiceException(String message) {
        super(message);
    }

    public ServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
