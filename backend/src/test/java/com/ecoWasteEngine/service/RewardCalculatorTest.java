package com.ecoWasteEngine.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ecoWasteEngine.config.WasteEngineProperties;
import com.ecoWasteEngine.model.RewardState;
import com.ecoWasteEngine.model.enums.Achievement;
import com.ecoWasteEngine.model.enums.WasteCategory;
import com.ecoWasteEngine.store.RewardStore;
import com.google.cloud.Timestamp;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RewardCalculatorTest {

    private static final LocalDate TODAY = LocalDate.parse("2026-03-10");

    private final RewardCalculator calculator = new RewardCalculator(new WasteEngineProperties());

    private static RewardState state(int streak, String lastActivity, long points) {
        return RewardState.builder()
                .userId("u1")
                .currentStreak(streak)
                .longestStreak(streak)
                .lastActivityDate(lastActivity)
                .totalPoints(points)
                .totalEntries(5)
                .level(1)
                .build();
    }

    @Nested
    class Streaks {

        @Test
        void firstActivityStartsAStreakOfOne() {
            assertThat(calculator.nextStreak(RewardState.empty("u1"), TODAY)).isEqualTo(1);
        }

        @Test
        void activityTheDayAfterExtendsTheStreak() {
            assertThat(calculator.nextStreak(state(2, "2026-03-09", 20), TODAY)).isEqualTo(3);
        }

        @Test
        void secondActivityOnTheSameDayKeepsTheStreak() {
            assertThat(calculator.nextStreak(state(4, "2026-03-10", 40), TODAY)).isEqualTo(4);
        }

        @Test
        void aGapResetsTheStreakToOne() {
            assertThat(calculator.nextStreak(state(9, "2026-03-07", 90), TODAY)).isEqualTo(1);
        }
    }

    @Nested
    class Milestones {

        @Test
        void bonusIsPaidWhenTheStreakReachesAMilestone() {
            assertThat(calculator.milestoneBonus(2, 3)).isEqualTo(25);
            assertThat(calculator.milestoneBonus(6, 7)).isEqualTo(75);
        }

        @Test
        void noBonusWhenTheStreakStaysOnAMilestone() {
            assertThat(calculator.milestoneBonus(3, 3)).isZero();
        }

        @Test
        void noBonusBetweenMilestones() {
            assertThat(calculator.milestoneBonus(3, 4)).isZero();
        }
    }

    @ParameterizedTest
    @CsvSource({
        "0, 1",
        "99, 1",
        "100, 2",
        "299, 2",
        "300, 3",
        "5199, 9",
        "5200, 10",
        "999999, 10"
    })
    void levelIsAStepFunctionOfTotalPoints(long points, int level) {
        assertThat(calculator.levelFor(points)).isEqualTo(level);
    }

    @Test
    void pointsToNextLevelIsZeroAtTheTop() {
        assertThat(calculator.pointsToNextLevel(95)).isEqualTo(5);
        assertThat(calculator.pointsToNextLevel(6000)).isZero();
    }

    @Test
    void levelNamesFollowTheLevel() {
        assertThat(calculator.levelName(1)).isEqualTo("Eco Beginner");
        assertThat(calculator.levelName(10)).isEqualTo("Eco Legend");
        assertThat(calculator.levelName(42)).isEqualTo("Eco Legend");
    }

    @Test
    void computeReachingStreakThreeAwardsBaseCategoryAndMilestone() {
        Timestamp now = Timestamp.parseTimestamp("2026-03-10T08:00:00Z");

        RewardStore.Outcome outcome = calculator.compute(
                state(2, "2026-03-09", 95), "entry-1", WasteCategory.RECYCLABLE, TODAY, now);

        assertThat(outcome.transaction().getCategoryBonus()).isEqualTo(5);
        assertThat(outcome.transaction().getStreakBonus()).isEqualTo(25);
        assertThat(outcome.transaction().getFirstTimeBonus()).isZero();
        assertThat(outcome.transaction().getPointsAwarded()).isEqualTo(40);
        assertThat(outcome.transaction().getStreakDelta()).isEqualTo(1);
        assertThat(outcome.transaction().getStreakAfter()).isEqualTo(3);
        assertThat(outcome.transaction().getLevelAfter()).isEqualTo(2);
        assertThat(outcome.newState().getTotalPoints()).isEqualTo(135);
        assertThat(outcome.newState().getTotalEntries()).isEqualTo(6);
        assertThat(outcome.newState().getCategoryCounts()).containsEntry("RECYCLABLE", 1);
        assertThat(outcome.newState().getLastActivityDate()).isEqualTo("2026-03-10");
        assertThat(outcome.newState().getLongestStreak()).isEqualTo(3);
    }

    @Test
    void resetStreakReportsANegativeDelta() {
        RewardStore.Outcome outcome = calculator.compute(
                state(5, "2026-03-01", 200), "entry-2", WasteCategory.ORGANIC, TODAY, Timestamp.now());

        assertThat(outcome.transaction().getStreakDelta()).isEqualTo(-4);
        assertThat(outcome.newState().getLongestStreak()).isEqualTo(5);
    }

    @Test
    void rejectsThresholdsThatDoNotStartAtZero() {
        assertThatThrownBy(() -> new RewardCalculator(10, Map.of(), 0, Map.of(), List.of(5L, 100L)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @CsvSource({
        "RECYCLABLE, 5",
        "ORGANIC, 5",
        "HAZARDOUS, 3",
        "GENERAL, 0",
        "ELECTRONIC, 0"
    })
    void categoryBonusFavoursSortedStreams(WasteCategory category, int bonus) {
        assertThat(calculator.categoryBonus(category)).isEqualTo(bonus);
    }

    @Nested
    class FirstEntryAndAchievements {

        private final Timestamp now = Timestamp.parseTimestamp("2026-03-10T08:00:00Z");

        @Test
        void firstEverEntryPaysTheWelcomeBonusAndUnlocksFirstSort() {
            RewardStore.Outcome outcome = calculator.compute(
                    RewardState.empty("u1"), "e1", WasteCategory.ORGANIC, TODAY, now);

            assertThat(outcome.transaction().getFirstTimeBonus()).isEqualTo(20);
            assertThat(outcome.transaction().getUnlockedAchievements()).containsExactly("FIRST_SORT");
            assertThat(outcome.transaction().getAchievementBonus()).isEqualTo(10);
            assertThat(outcome.transaction().getPointsAwarded()).isEqualTo(10 + 5 + 20 + 10);
            assertThat(outcome.newState().getAchievements()).containsExactly("FIRST_SORT");
            assertThat(outcome.newState().getTotalPoints()).isEqualTo(45);
        }

        @Test
        void welcomeBonusIsNotPaidTwice() {
            RewardState afterFirst = calculator.compute(
                    RewardState.empty("u1"), "e1", WasteCategory.GENERAL, TODAY, now).newState();

            RewardStore.Outcome second = calculator.compute(afterFirst, "e2", WasteCategory.GENERAL, TODAY, now);

            assertThat(second.transaction().getFirstTimeBonus()).isZero();
            assertThat(second.transaction().getUnlockedAchievements()).isEmpty();
            assertThat(second.transaction().getPointsAwarded()).isEqualTo(10);
        }

        @Test
        void achievementUnlocksOnceWhenItsTargetIsReached() {
            RewardState nine = state(1, "2026-03-10", 300).toBuilder()
                    .totalEntries(9)
                    .achievements(List.of("FIRST_SORT"))
                    .build();

            RewardStore.Outcome tenth = calculator.compute(nine, "e10", WasteCategory.GENERAL, TODAY, now);
            RewardStore.Outcome eleventh = calculator.compute(
                    tenth.newState(), "e11", WasteCategory.GENERAL, TODAY, now);

            assertThat(tenth.transaction().getUnlockedAchievements()).containsExactly("TEN_SORTS");
            assertThat(tenth.newState().getTotalPoints()).isEqualTo(300 + 10 + 50);
            assertThat(tenth.newState().getAchievements()).containsExactly("FIRST_SORT", "TEN_SORTS");
            assertThat(eleventh.transaction().getUnlockedAchievements()).isEmpty();
        }

        @Test
        void progressCountsEntriesPerCategory() {
            RewardState state = RewardState.empty("u1").toBuilder()
                    .categoryCounts(Map.of("HAZARDOUS", 4))
                    .build();

            assertThat(calculator.progress(Achievement.SAFE_HANDS, state)).isEqualTo(4);
            assertThat(calculator.progress(Achievement.RECYCLER, state)).isZero();
        }
    }
}
