package com.ecoWasteEngine.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ecoWasteEngine.config.WasteEngineProperties;
import com.ecoWasteEngine.model.RewardState;
import com.ecoWasteEngine.model.RewardTransaction;
import com.ecoWasteEngine.model.enums.WasteCategory;
import com.ecoWasteEngine.store.memory.InMemoryRewardStore;
import com.ecoWasteEngine.support.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RewardLedgerTest {

    private MutableClock clock;
    private InMemoryRewardStore store;
    private RewardLedger ledger;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-08T09:00:00Z");
        store = new InMemoryRewardStore();
        ledger = new RewardLedger(store, new RewardCalculator(new WasteEngineProperties()), clock);
    }

    @Test
    void applyingTheSameEntryTwiceWritesOneTransaction() {
        RewardTransaction first = ledger.apply("u1", "entry-1", WasteCategory.RECYCLABLE);
        RewardTransaction second = ledger.apply("u1", "entry-1", WasteCategory.RECYCLABLE);

        assertThat(second).isEqualTo(first);
        assertThat(ledger.getTransactions("u1", 10)).hasSize(1);
        // base 10, recyclable 5, first entry 20, FIRST_SORT 10
        assertThat(ledger.getState("u1").getTotalPoints()).isEqualTo(45);
    }

    @Test
    void consecutiveDaysBuildAStreakAndPayTheMilestone() {
        ledger.apply("u1", "e1", WasteCategory.ORGANIC);
        clock.advance(Duration.ofDays(1));
        ledger.apply("u1", "e2", WasteCategory.ORGANIC);
        clock.advance(Duration.ofDays(1));
        RewardTransaction third = ledger.apply("u1", "e3", WasteCategory.ORGANIC);

        assertThat(third.getStreakAfter()).isEqualTo(3);
        assertThat(third.getStreakBonus()).isEqualTo(25);
        assertThat(ledger.getState("u1").getTotalPoints()).isEqualTo(45 + 15 + 40);
    }

    @Test
    void sameDayActivityKeepsTheStreak() {
        ledger.apply("u1", "e1", WasteCategory.GENERAL);
        clock.advance(Duration.ofHours(3));
        RewardTransaction second = ledger.apply("u1", "e2", WasteCategory.GENERAL);

        assertThat(second.getStreakDelta()).isZero();
        assertThat(ledger.getState("u1").getCurrentStreak()).isEqualTo(1);
    }

    @Test
    void gapResetsTheStreak() {
        ledger.apply("u1", "e1", WasteCategory.GENERAL);
        clock.advance(Duration.ofDays(1));
        ledger.apply("u1", "e2", WasteCategory.GENERAL);
        clock.advance(Duration.ofDays(3));
        ledger.apply("u1", "e3", WasteCategory.GENERAL);

        RewardState state = ledger.getState("u1");
        assertThat(state.getCurrentStreak()).isEqualTo(1);
        assertThat(state.getLongestStreak()).isEqualTo(2);
    }

    @Test
    void leaderboardRanksUsersByTotalPoints() {
        ledger.apply("u1", "e1", WasteCategory.GENERAL);
        ledger.apply("u2", "e2", WasteCategory.RECYCLABLE);
        ledger.apply("u2", "e3", WasteCategory.RECYCLABLE);

        assertThat(ledger.getLeaderboard(10)).extracting(RewardState::getUserId).containsExactly("u2", "u1");
        assertThat(ledger.getLeaderboard(1)).hasSize(1);
    }

    @Test
    void unknownUserHasTheZeroState() {
        RewardState state = ledger.getState("nobody");

        assertThat(state.getTotalPoints()).isZero();
        assertThat(state.getLevel()).isEqualTo(1);
        assertThat(state.getLastActivityDate()).isNull();
    }
}
