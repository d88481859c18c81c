package com.ecoWasteEngine.model.enums;

/**
 * Fixed achievement catalogue. Each one unlocks once per user, when its
 * requirement is first met after a rewarded entry.
 */
public enum Achievement {
    FIRST_SORT("First Sort", "Sort your first item", Requirement.TOTAL_ENTRIES, 1, 10),
    TEN_SORTS("Getting the Hang of It", "Sort 10 items", Requirement.TOTAL_ENTRIES, 10, 50),
    FIFTY_SORTS("Sorting Pro", "Sort 50 items", Requirement.TOTAL_ENTRIES, 50, 200),
    WEEK_STREAK("Week Warrior", "Keep a 7 day streak", Requirement.STREAK_DAYS, 7, 100),
    MONTH_STREAK("Habit Formed", "Keep a 30 day streak", Requirement.STREAK_DAYS, 30, 300),
    RECYCLER("Recycler", "Sort 25 recyclable items", Requirement.RECYCLABLE_ENTRIES, 25, 100),
    COMPOSTER("Composter", "Sort 25 organic items", Requirement.ORGANIC_ENTRIES, 25, 100),
    SAFE_HANDS("Safe Hands", "Hand in 5 hazardous items", Requirement.HAZARDOUS_ENTRIES, 5, 75),
    THOUSAND_POINTS("Point Collector", "Earn 1000 points", Requirement.TOTAL_POINTS, 1000, 100);

    public enum Requirement {
        TOTAL_ENTRIES,
        STREAK_DAYS,
        TOTAL_POINTS,
        RECYCLABLE_ENTRIES,
        ORGANIC_ENTRIES,
        HAZARDOUS_ENTRIES
    }

    private final String displayName;
    private final String description;
    private final Requirement requirement;
    private final long target;
    private final int pointsReward;

    Achievement(String displayName, String description, Requirement requirement, long target, int pointsReward) {
        this.displayName = displayName;
        this.description = description;
        this.requirement = requirement;
        this.target = target;
        this.pointsReward = pointsReward;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public Requirement getRequirement() {
        return requirement;
    }

    public long getTarget() {
        return target;
    }

    public int getPointsReward() {
        return pointsReward;
    }
}
