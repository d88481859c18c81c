package com.ecoWasteEngine.store.firestore;

import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.ecoWasteEngine.model.RewardState;
import com.ecoWasteEngine.model.RewardTransaction;
import com.ecoWasteEngine.store.RewardStore;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reward state lives in {@value #STATES}, one document per user; transactions
 * in {@value #TRANSACTIONS}, one document per waste entry, which is what makes
 * a second application for the same entry a no-op.
 */
@Component
@ConditionalOnProperty(name = "waste-engine.store", havingValue = "firestore", matchIfMissing = true)
@RequiredArgsConstructor
public class FirestoreRewardStore implements RewardStore {

    private static final String STATES = "reward_states";
    private static final String TRANSACTIONS = "reward_transactions";

    private final Firestore firestore;

    @Override
    public Optional<RewardState> findState(String userId) {
        DocumentSnapshot doc = FirestoreCalls.await(
                firestore.collection(STATES).document(userId).get(), "get reward state of " + userId);
        return doc.exists() ? Optional.of(doc.toObject(RewardState.class)) : Optional.empty();
    }

    @Override
    public Optional<RewardTransaction> findTransaction(String entryId) {
        DocumentSnapshot doc = FirestoreCalls.await(
                firestore.collection(TRANSACTIONS).document(entryId).get(), "get reward transaction " + entryId);
        return doc.exists() ? Optional.of(doc.toObject(RewardTransaction.class)) : Optional.empty();
    }

    @Override
    public List<RewardTransaction> findTransactions(String userId, int limit) {
        List<RewardTransaction> transactions = new ArrayList<>();
        for (QueryDocumentSnapshot doc : FirestoreCalls.await(firestore.collection(TRANSACTIONS)
                .whereEqualTo("user_id", userId)
                .orderBy("created_at", Query.Direction.DESCENDING)
                .limit(limit)
                .get(), "list reward transactions of " + userId).getDocuments()) {
            transactions.add(doc.toObject(RewardTransaction.class));
        }
        return transactions;
    }

    @Override
    public List<RewardState> findTopByPoints(int limit) {
        List<RewardState> states = new ArrayList<>();
        for (QueryDocumentSnapshot doc : FirestoreCalls.await(firestore.collection(STATES)
                .orderBy("total_points", Query.Direction.DESCENDING)
                .limit(limit)
                .get(), "list leaderboard").getDocuments()) {
            states.add(doc.toObject(RewardState.class));
        }
        return states;
    }

    @Override
    public RewardTransaction applyOnce(String userId, String entryId, RewardComputation computation) {
        DocumentReference txRef = firestore.collection(TRANSACTIONS).document(entryId);
        DocumentReference stateRef = firestore.collection(STATES).document(userId);
        return FirestoreCalls.await(firestore.runTransaction(transaction -> {
            DocumentSnapshot existing = transaction.get(txRef).get();
            if (existing.exists()) {
                return existing.toObject(RewardTransaction.class);
            }
            DocumentSnapshot stateDoc = transaction.get(stateRef).get();
            RewardState current = stateDoc.exists()
                    ? stateDoc.toObject(RewardState.class)
                    : RewardState.empty(userId);
            Outcome outcome = computation.compute(current);
            transaction.set(stateRef, outcome.newState());
            transaction.set(txRef, outcome.transaction());
            return outcome.transaction();
        }), "apply reward for entry " + entryId);
    }
}
