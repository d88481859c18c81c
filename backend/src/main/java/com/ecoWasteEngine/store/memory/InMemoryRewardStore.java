package com.ecoWasteEngine.store.memory;

import com.ecoWasteEngine.model.RewardState;
import com.ecoWasteEngine.model.RewardTransaction;
import com.ecoWasteEngine.store.RewardStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Component
@ConditionalOnProperty(name = "waste-engine.store", havingValue = "memory")
public class InMemoryRewardStore implements RewardStore {

    private final Map<String, RewardState> states = new ConcurrentHashMap<>();
    private final Map<String, RewardTransaction> transactions = new ConcurrentHashMap<>();

    @Override
    public Optional<RewardState> findState(String userId) {
        return Optional.ofNullable(states.get(userId)).map(s -> s.toBuilder().build());
    }

    @Override
    public Optional<RewardTransaction> findTransaction(String entryId) {
        return Optional.ofNullable(transactions.get(entryId)).map(t -> t.toBuilder().build());
    }

    @Override
    public List<RewardTransaction> findTransactions(String userId, int limit) {
        return transactions.values().stream()
                .filter(t -> userId.equals(t.getUserId()))
                .sorted(Comparator.comparing(RewardTransaction::getCreatedAt).reversed())
                .limit(limit)
                .map(t -> t.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public List<RewardState> findTopByPoints(int limit) {
        return states.values().stream()
                .sorted(Comparator.comparingLong(RewardState::getTotalPoints).reversed())
                .limit(limit)
                .map(s -> s.toBuilder().build())
                .collect(Collectors.toList());
    }

    /** One writer at a time keeps the state row and the transaction row consistent. */
    @Override
    public synchronized RewardTransaction applyOnce(String userId, String entryId, RewardComputation computation) {
        RewardTransaction existing = transactions.get(entryId);
        if (existing != null) {
            return existing.toBuilder().build();
        }
        RewardState current = states.getOrDefault(userId, RewardState.empty(userId)).toBuilder().build();
        Outcome outcome = computation.compute(current);
        states.put(userId, outcome.newState().toBuilder().build());
        transactions.put(entryId, outcome.transaction().toBuilder().build());
        return outcome.transaction().toBuilder().build();
    }
}
