package com.ecoWasteEngine.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived map from a dedup key (submitter + content hash) to the entry id
 * that owns it. A claim either wins the key or reports the current holder.
 */
public interface FingerprintCache {

    /**
     * Atomically claims {@code key} for {@code entryId} unless a live claim
     * already exists.
     *
     * @return the winning claim; {@link Claim#isOwner()} is false when someone
     *         else holds the key
     */
    Claim claim(String key, String entryId, Duration ttl);

    Optional<String> lookup(String key);

    /** Drops the claim, but only if {@code entryId} still holds it */
    void release(String key, String entryId);

    final class Claim {
        private final String entryId;
        private final boolean owner;

        private Claim(String entryId, boolean owner) {
            this.entryId = entryId;
            this.owner = owner;
        }

        public static Claim won(String entryId) {
            return new Claim(entryId, true);
        }

        public static Claim heldBy(String entryId) {
            return new Claim(entryId, false);
        }

        public String getEntryId() {
            return entryId;
        }

        public boolean isOwner() {
            return owner;
        }
    }
}
