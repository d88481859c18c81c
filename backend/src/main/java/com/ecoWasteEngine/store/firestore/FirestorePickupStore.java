package com.ecoWasteEngine.store.firestore;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.ecoWasteEngine.exception.PickupConflictException;
import com.ecoWasteEngine.exception.ResourceNotFoundException;
import com.ecoWasteEngine.model.Pickup;
import com.ecoWasteEngine.model.PickupStatusChange;
import com.ecoWasteEngine.model.enums.PickupStatus;
import com.ecoWasteEngine.store.PickupChange;
import com.ecoWasteEngine.store.PickupStore;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
@ConditionalOnProperty(name = "waste-engine.store", havingValue = "firestore", matchIfMissing = true)
@RequiredArgsConstructor
public class FirestorePickupStore implements PickupStore {

    private static final String COLLECTION_NAME = "pickups";

    private final Firestore firestore;

    @Override
    public Pickup create(Pickup pickup) {
        DocumentReference docRef = firestore.collection(COLLECTION_NAME).document(pickup.getId());
        FirestoreCalls.await(docRef.create(pickup), "create pickup " + pickup.getId());
        return pickup;
    }

    @Override
    public Optional<Pickup> findById(String id) {
        DocumentSnapshot doc = FirestoreCalls.await(
                firestore.collection(COLLECTION_NAME).document(id).get(), "get pickup " + id);
        return doc.exists() ? Optional.of(toPickup(doc)) : Optional.empty();
    }

    @Override
    public List<Pickup> findActiveByEntry(String wasteEntryId) {
        List<Pickup> active = new ArrayList<>();
        for (Pickup pickup : list(firestore.collection(COLLECTION_NAME)
                .whereEqualTo("waste_entry_id", wasteEntryId), "list pickups of entry " + wasteEntryId)) {
            if (!pickup.getStatus().isTerminal()) {
                active.add(pickup);
            }
        }
        return active;
    }

    @Override
    public List<Pickup> findByStatus(PickupStatus status, int limit) {
        return list(firestore.collection(COLLECTION_NAME)
                .whereEqualTo("status", status.name())
                .orderBy("created_at", Query.Direction.ASCENDING)
                .limit(limit), "list " + status + " pickups");
    }

    @Override
    public List<Pickup> findByStatusCreatedBefore(PickupStatus status, Timestamp cutoff) {
        return list(firestore.collection(COLLECTION_NAME)
                .whereEqualTo("status", status.name())
                .whereLessThan("created_at", cutoff)
                .orderBy("created_at", Query.Direction.ASCENDING), "list expired " + status + " pickups");
    }

    @Override
    public Pickup compareAndSwapStatus(String id, long expectedVersion, PickupChange change) {
        DocumentReference docRef = firestore.collection(COLLECTION_NAME).document(id);
        return FirestoreCalls.await(firestore.runTransaction(transaction -> {
            DocumentSnapshot doc = transaction.get(docRef).get();
            if (!doc.exists()) {
                throw new ResourceNotFoundException("Pickup", id);
            }
            Pickup pickup = toPickup(doc);
            if (pickup.getVersion() != expectedVersion) {
                throw new PickupConflictException(id, expectedVersion, pickup.getVersion());
            }
            PickupStatus from = pickup.getStatus();
            pickup.setStatus(change.getNewStatus());
            pickup.setAssignedDriverId(change.getAssignedDriverId());
            if (change.getReason() != null) {
                pickup.setReason(change.getReason());
            }
            pickup.setVersion(expectedVersion + 1);
            pickup.setUpdatedAt(change.getAt());
            pickup.getHistory().add(PickupStatusChange.builder()
                    .from(from)
                    .to(change.getNewStatus())
                    .actor(change.getActor())
                    .version(pickup.getVersion())
                    .at(change.getAt())
                    .build());
            transaction.set(docRef, pickup);
            return pickup;
        }), "transition pickup " + id);
    }

    private List<Pickup> list(Query query, String action) {
        List<Pickup> pickups = new ArrayList<>();
        for (QueryDocumentSnapshot doc : FirestoreCalls.await(query.get(), action).getDocuments()) {
            pickups.add(toPickup(doc));
        }
        return pickups;
    }

    private static Pickup toPickup(DocumentSnapshot doc) {
        Pickup pickup = doc.toObject(Pickup.class);
        pickup.setId(doc.getId());
        if (pickup.getHistory() == null) {
            pickup.setHistory(new ArrayList<>());
        }
        return pickup;
    }
}
