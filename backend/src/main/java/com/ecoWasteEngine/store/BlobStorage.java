package com.ecoWasteEngine.store;

/** Binary image storage. Failures are reported as StorageException. */
public interface BlobStorage {

    /** @return opaque handle to pass back to {@link #get(String)} */
    String put(byte[] bytes, String contentType);

    byte[] get(String handle);
}
