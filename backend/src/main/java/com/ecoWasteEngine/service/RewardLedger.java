package com.ecoWasteEngine.service;

import com.ecoWasteEngine.model.RewardState;
import com.ecoWasteEngine.model.RewardTransaction;
import com.ecoWasteEngine.model.Timestamps;
import com.ecoWasteEngine.model.enums.WasteCategory;
import com.ecoWasteEngine.store.RewardStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Applies rewards exactly once per waste entry. A second apply for the same
 * entry returns the first transaction and changes nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RewardLedger {

    private final RewardStore rewardStore;
    private final RewardCalculator calculator;
    private final Clock clock;

    public RewardTransaction apply(String userId, String entryId, WasteCategory category) {
        if (userId == null || userId.isBlank() || entryId == null || entryId.isBlank()) {
            throw new IllegalArgumentException("userId and entryId are required");
        }
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        RewardTransaction transaction = rewardStore.applyOnce(userId, entryId,
                current -> calculator.compute(current, entryId, category, today, Timestamps.now(clock)));
        log.info("[Reward] Entry {} for user {}: +{} points, streak {}",
                entryId, userId, transaction.getPointsAwarded(), transaction.getStreakAfter());
        if (transaction.getUnlockedAchievements() != null && !transaction.getUnlockedAchievements().isEmpty()) {
            log.info("[Reward] User {} unlocked {}", userId, transaction.getUnlockedAchievements());
        }
        return transaction;
    }

    /** Unknown users get the zero state rather than a 404 */
    public RewardState getState(String userId) {
        return rewardStore.findState(userId).orElseGet(() -> RewardState.empty(userId));
    }

    public List<RewardTransaction> getTransactions(String userId, int limit) {
        return rewardStore.findTransactions(userId, limit);
    }

    /** All-time ranking by total points */
    public List<RewardState> getLeaderboard(int limit) {
        return rewardStore.findTopByPoints(limit);
    }
}
