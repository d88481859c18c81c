package com.ecoWasteEngine.store;

import com.ecoWasteEngine.model.RewardState;
import com.ecoWasteEngine.model.RewardTransaction;

import java.util.List;
import java.util.Optional;

public interface RewardStore {

    Optional<RewardState> findState(String userId);

    Optional<RewardTransaction> findTransaction(String entryId);

    /** Newest first */
    List<RewardTransaction> findTransactions(String userId, int limit);

    /** Highest total points first */
    List<RewardState> findTopByPoints(int limit);

    /**
     * Atomically applies a reward for {@code entryId}. If a transaction for the
     * entry already exists it is returned and nothing is written; otherwise the
     * computation runs against the user's current state (or an empty one) and
     * the new state and transaction are stored together.
     */
    RewardTransaction applyOnce(String userId, String entryId, RewardComputation computation);

    @FunctionalInterface
    interface RewardComputation {
        Outcome compute(RewardState current);
    }

    record Outcome(RewardState newState, RewardTransaction transaction) {
    }
}
