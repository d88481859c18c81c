package com.ecoWasteEngine.exception;

/** The presented version is stale. The caller re-reads the pickup and retries. */
public class PickupConflictException extends RuntimeException {

    private final long expectedVersion;
    private final long currentVersion;

    public PickupConflictException(String pickupId, long expectedVersion, long currentVersion) {
        super("Pickup " + pickupId + " is at version " + currentVersion + ", not " + expectedVersion);
        this.expectedVersion = expectedVersion;
        this.currentVersion = currentVersion;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getCurrentVersion() {
        return currentVersion;
    }
}
