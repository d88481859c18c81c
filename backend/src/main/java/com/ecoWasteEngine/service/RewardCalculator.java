package com.ecoWasteEngine.service;

import com.ecoWasteEngine.config.WasteEngineProperties;
import com.ecoWasteEngine.model.RewardState;
import com.ecoWasteEngine.model.RewardTransaction;
import com.ecoWasteEngine.model.enums.Achievement;
import com.ecoWasteEngine.model.enums.WasteCategory;
import com.ecoWasteEngine.store.RewardStore;
import com.google.cloud.Timestamp;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Pure reward arithmetic: streak rules, point bonuses, achievements and the
 * level step function. The date of the activity is always passed in.
 */
@Component
public class RewardCalculator {

    private static final List<String> LEVEL_NAMES = List.of(
            "Eco Beginner",
            "Waste Warrior",
            "Green Guardian",
            "Recycling Ranger",
            "Sustainability Scout",
            "Environmental Elite",
            "Planet Protector",
            "Climate Champion",
            "Earth Ambassador",
            "Eco Legend");

    private final int basePoints;
    private final Map<WasteCategory, Integer> categoryBonus;
    private final int firstTimeBonus;
    private final Map<Integer, Integer> streakMilestones;
    private final List<Long> levelThresholds;

    @Autowired
    public RewardCalculator(WasteEngineProperties properties) {
        this(properties.getRewards().getBasePoints(),
                properties.getRewards().getCategoryBonus(),
                properties.getRewards().getFirstTimeBonus(),
                properties.getRewards().getStreakMilestones(),
                properties.getRewards().getLevelThresholds());
    }

    public RewardCalculator(int basePoints, Map<WasteCategory, Integer> categoryBonus, int firstTimeBonus,
            Map<Integer, Integer> streakMilestones, List<Long> levelThresholds) {
        if (levelThresholds.isEmpty() || levelThresholds.get(0) != 0L) {
            throw new IllegalArgumentException("Level thresholds must start at 0");
        }
        for (int i = 1; i < levelThresholds.size(); i++) {
            if (levelThresholds.get(i) <= levelThresholds.get(i - 1)) {
                throw new IllegalArgumentException("Level thresholds must be strictly increasing");
            }
        }
        this.basePoints = basePoints;
        this.categoryBonus = categoryBonus.isEmpty()
                ? new EnumMap<>(WasteCategory.class)
                : new EnumMap<>(categoryBonus);
        this.firstTimeBonus = firstTimeBonus;
        this.streakMilestones = new TreeMap<>(streakMilestones);
        this.levelThresholds = List.copyOf(levelThresholds);
    }

    /**
     * Streak after an activity on {@code today}: unchanged on the same day,
     * +1 the day after the last activity, otherwise back to 1.
     */
    public int nextStreak(RewardState current, LocalDate today) {
        if (current.getLastActivityDate() == null || current.getCurrentStreak() <= 0) {
            return 1;
        }
        LocalDate last = LocalDate.parse(current.getLastActivityDate());
        if (last.equals(today)) {
            return current.getCurrentStreak();
        }
        if (last.plusDays(1).equals(today)) {
            return current.getCurrentStreak() + 1;
        }
        // an activity dated before the last one keeps the streak as is
        if (today.isBefore(last)) {
            return current.getCurrentStreak();
        }
        return 1;
    }

    /** Bonus for reaching a milestone, paid only on the day the streak reaches it. */
    public int milestoneBonus(int oldStreak, int newStreak) {
        if (newStreak <= oldStreak) {
            return 0;
        }
        return streakMilestones.getOrDefault(newStreak, 0);
    }

    /** 1-based level: the number of thresholds at or below {@code totalPoints}. */
    public int levelFor(long totalPoints) {
        int level = 0;
        for (Long threshold : levelThresholds) {
            if (totalPoints >= threshold) {
                level++;
            }
        }
        return Math.max(level, 1);
    }

    public String levelName(int level) {
        int index = Math.min(Math.max(level, 1), LEVEL_NAMES.size()) - 1;
        return LEVEL_NAMES.get(index);
    }

    /** 0 at the top level */
    public long pointsToNextLevel(long totalPoints) {
        int level = levelFor(totalPoints);
        if (level >= levelThresholds.size()) {
            return 0;
        }
        return Math.max(0, levelThresholds.get(level) - totalPoints);
    }

    public int categoryBonus(WasteCategory category) {
        return category == null ? 0 : categoryBonus.getOrDefault(category, 0);
    }

    /** Progress of {@code state} towards an achievement, in the achievement's own unit. */
    public long progress(Achievement achievement, RewardState state) {
        switch (achievement.getRequirement()) {
            case TOTAL_ENTRIES:
                return state.getTotalEntries();
            case STREAK_DAYS:
                return state.getCurrentStreak();
            case TOTAL_POINTS:
                return state.getTotalPoints();
            case RECYCLABLE_ENTRIES:
                return countOf(state, WasteCategory.RECYCLABLE);
            case ORGANIC_ENTRIES:
                return countOf(state, WasteCategory.ORGANIC);
            case HAZARDOUS_ENTRIES:
                return countOf(state, WasteCategory.HAZARDOUS);
            default:
                throw new IllegalStateException("Unhandled requirement " + achievement.getRequirement());
        }
    }

    private static int countOf(RewardState state, WasteCategory category) {
        Map<String, Integer> counts = state.getCategoryCounts();
        return counts == null ? 0 : counts.getOrDefault(category.name(), 0);
    }

    /**
     * Applies one rewarded entry: streak, base and bonus points, then any
     * achievements the new totals unlock. Achievement points count towards the
     * level but are not themselves checked against point achievements.
     */
    public RewardStore.Outcome compute(RewardState current, String entryId, WasteCategory category,
            LocalDate today, Timestamp now) {
        int oldStreak = current.getCurrentStreak();
        int newStreak = nextStreak(current, today);
        int streakBonus = milestoneBonus(oldStreak, newStreak);
        int typeBonus = categoryBonus(category);
        boolean firstEntry = current.getTotalEntries() == 0 && current.getLastActivityDate() == null;
        int welcomeBonus = firstEntry ? firstTimeBonus : 0;
        int earned = basePoints + typeBonus + welcomeBonus + streakBonus;

        String lastActivity = current.getLastActivityDate();
        if (lastActivity == null || today.isAfter(LocalDate.parse(lastActivity))) {
            lastActivity = today.toString();
        }
        Map<String, Integer> counts = current.getCategoryCounts() == null
                ? new HashMap<>()
                : new HashMap<>(current.getCategoryCounts());
        if (category != null) {
            counts.merge(category.name(), 1, Integer::sum);
        }

        RewardState progressed = current.toBuilder()
                .totalPoints(current.getTotalPoints() + earned)
                .currentStreak(newStreak)
                .longestStreak(Math.max(current.getLongestStreak(), newStreak))
                .totalEntries(current.getTotalEntries() + 1)
                .categoryCounts(counts)
                .lastActivityDate(lastActivity)
                .build();

        List<String> held = current.getAchievements() == null ? List.of() : current.getAchievements();
        List<String> achievements = new ArrayList<>(held);
        List<String> unlocked = new ArrayList<>();
        int achievementBonus = 0;
        for (Achievement achievement : Achievement.values()) {
            if (!held.contains(achievement.name()) && progress(achievement, progressed) >= achievement.getTarget()) {
                unlocked.add(achievement.name());
                achievementBonus += achievement.getPointsReward();
            }
        }
        achievements.addAll(unlocked);

        long total = progressed.getTotalPoints() + achievementBonus;
        int level = levelFor(total);
        RewardState next = progressed.toBuilder()
                .totalPoints(total)
                .level(level)
                .achievements(achievements)
                .updatedAt(now)
                .build();
        RewardTransaction transaction = RewardTransaction.builder()
                .entryId(entryId)
                .userId(current.getUserId())
                .category(category)
                .basePoints(basePoints)
                .categoryBonus(typeBonus)
                .firstTimeBonus(welcomeBonus)
                .streakBonus(streakBonus)
                .achievementBonus(achievementBonus)
                .unlockedAchievements(unlocked)
                .pointsAwarded(earned + achievementBonus)
                .streakDelta(newStreak - oldStreak)
                .streakAfter(newStreak)
                .levelAfter(level)
                .createdAt(now)
                .build();
        return new RewardStore.Outcome(next, transaction);
    }
}
