package com.ecoWasteEngine.store.firestore;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.ecoWasteEngine.model.Timestamps;
import com.ecoWasteEngine.store.FingerprintCache;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Claims live in {@value #COLLECTION_NAME}, one document per dedup key. The
 * claim runs in a transaction so two concurrent uploads cannot both win.
 */
@Component
@ConditionalOnProperty(name = "waste-engine.store", havingValue = "firestore", matchIfMissing = true)
@RequiredArgsConstructor
public class FirestoreFingerprintCache implements FingerprintCache {

    private static final String COLLECTION_NAME = "upload_fingerprints";
    private static final String ENTRY_ID = "entry_id";
    private static final String EXPIRES_AT = "expires_at";

    private final Firestore firestore;
    private final Clock clock;

    @Override
    public Claim claim(String key, String entryId, Duration ttl) {
        DocumentReference docRef = firestore.collection(COLLECTION_NAME).document(key);
        return FirestoreCalls.await(firestore.runTransaction(transaction -> {
            DocumentSnapshot doc = transaction.get(docRef).get();
            Timestamp now = Timestamps.now(clock);
            if (isLive(doc, now)) {
                String holder = doc.getString(ENTRY_ID);
                return holder.equals(entryId) ? Claim.won(entryId) : Claim.heldBy(holder);
            }
            transaction.set(docRef, Map.of(
                    ENTRY_ID, entryId,
                    EXPIRES_AT, Timestamps.of(Timestamps.toInstant(now).plus(ttl))));
            return Claim.won(entryId);
        }), "claim upload fingerprint");
    }

    @Override
    public Optional<String> lookup(String key) {
        DocumentSnapshot doc = FirestoreCalls.await(
                firestore.collection(COLLECTION_NAME).document(key).get(), "read upload fingerprint");
        return isLive(doc, Timestamps.now(clock)) ? Optional.ofNullable(doc.getString(ENTRY_ID)) : Optional.empty();
    }

    @Override
    public void release(String key, String entryId) {
        DocumentReference docRef = firestore.collection(COLLECTION_NAME).document(key);
        FirestoreCalls.await(firestore.runTransaction(transaction -> {
            DocumentSnapshot doc = transaction.get(docRef).get();
            if (doc.exists() && entryId.equals(doc.getString(ENTRY_ID))) {
                transaction.delete(docRef);
            }
            return null;
        }), "release upload fingerprint");
    }

    private static boolean isLive(DocumentSnapshot doc, Timestamp now) {
        if (!doc.exists()) {
            return false;
        }
        Timestamp expiresAt = doc.getTimestamp(EXPIRES_AT);
        return expiresAt != null && expiresAt.compareTo(now) > 0;
    }
}
