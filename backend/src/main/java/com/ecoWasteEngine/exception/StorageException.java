package com.ecoWasteEngine.exception;

/** Blob storage failure. Fatal to ingestion: no entry is created without a stored image. */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
