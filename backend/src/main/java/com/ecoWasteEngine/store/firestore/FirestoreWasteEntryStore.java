package com.ecoWasteEngine.store.firestore;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.ecoWasteEngine.exception.ResourceNotFoundException;
import com.ecoWasteEngine.model.Classification;
import com.ecoWasteEngine.model.EntryStatusChange;
import com.ecoWasteEngine.model.Timestamps;
import com.ecoWasteEngine.model.WasteEntry;
import com.ecoWasteEngine.model.enums.WasteEntryStatus;
import com.ecoWasteEngine.store.WasteEntryStore;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
@ConditionalOnProperty(name = "waste-engine.store", havingValue = "firestore", matchIfMissing = true)
@RequiredArgsConstructor
public class FirestoreWasteEntryStore implements WasteEntryStore {

    private static final String COLLECTION_NAME = "waste_entries";

    private final Firestore firestore;
    private final Clock clock;

    @Override
    public WasteEntry create(WasteEntry entry) {
        DocumentReference docRef = firestore.collection(COLLECTION_NAME).document(entry.getId());
        // create() fails if the document exists, entries are never overwritten
        FirestoreCalls.await(docRef.create(entry), "create waste entry " + entry.getId());
        return entry;
    }

    @Override
    public Optional<WasteEntry> findById(String id) {
        DocumentSnapshot doc = FirestoreCalls.await(
                firestore.collection(COLLECTION_NAME).document(id).get(), "get waste entry " + id);
        return doc.exists() ? Optional.of(toEntry(doc)) : Optional.empty();
    }

    @Override
    public List<WasteEntry> findBySubmitter(String submitterId, int limit) {
        List<WasteEntry> entries = new ArrayList<>();
        List<QueryDocumentSnapshot> docs = FirestoreCalls.await(firestore.collection(COLLECTION_NAME)
                .whereEqualTo("submitter_id", submitterId)
                .orderBy("created_at", Query.Direction.DESCENDING)
                .limit(limit)
                .get(), "list waste entries of " + submitterId).getDocuments();
        for (QueryDocumentSnapshot doc : docs) {
            entries.add(toEntry(doc));
        }
        return entries;
    }

    @Override
    public List<WasteEntry> findPendingCreatedBefore(Timestamp cutoff, int limit) {
        List<WasteEntry> entries = new ArrayList<>();
        List<QueryDocumentSnapshot> docs = FirestoreCalls.await(firestore.collection(COLLECTION_NAME)
                .whereEqualTo("status", WasteEntryStatus.PENDING.name())
                .whereLessThan("created_at", cutoff)
                .orderBy("created_at", Query.Direction.ASCENDING)
                .limit(limit)
                .get(), "list pending waste entries").getDocuments();
        for (QueryDocumentSnapshot doc : docs) {
            entries.add(toEntry(doc));
        }
        return entries;
    }

    @Override
    public WasteEntry finalizeEntry(String id, WasteEntryStatus status, Classification classification) {
        if (!status.isFinal()) {
            throw new IllegalArgumentException("Not a final status: " + status);
        }
        DocumentReference docRef = firestore.collection(COLLECTION_NAME).document(id);
        return FirestoreCalls.await(firestore.runTransaction(transaction -> {
            DocumentSnapshot doc = transaction.get(docRef).get();
            if (!doc.exists()) {
                throw new ResourceNotFoundException("Waste entry", id);
            }
            WasteEntry entry = toEntry(doc);
            if (entry.getStatus().isFinal()) {
                throw new IllegalStateException("Waste entry " + id + " is already " + entry.getStatus());
            }
            entry.setStatus(status);
            entry.setClassification(classification);
            entry.setFinalizedAt(Timestamps.now(clock));
            entry.getStatusHistory().add(EntryStatusChange.builder()
                    .status(status)
                    .at(entry.getFinalizedAt())
                    .build());
            transaction.set(docRef, entry);
            return entry;
        }), "finalize waste entry " + id);
    }

    private static WasteEntry toEntry(DocumentSnapshot doc) {
        WasteEntry entry = doc.toObject(WasteEntry.class);
        entry.setId(doc.getId());
        if (entry.getStatusHistory() == null) {
            entry.setStatusHistory(new ArrayList<>());
        }
        return entry;
    }
}
