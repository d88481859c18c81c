package com.ecoWasteEngine.model;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.annotation.PropertyName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class RewardState {
    @Getter(onMethod_ = @PropertyName("user_id"))
    @Setter(onMethod_ = @PropertyName("user_id"))
    private String userId;

    @Getter(onMethod_ = @PropertyName("total_points"))
    @Setter(onMethod_ = @PropertyName("total_points"))
    private long totalPoints;

    @Getter(onMethod_ = @PropertyName("current_streak"))
    @Setter(onMethod_ = @PropertyName("current_streak"))
    private int currentStreak;

    @Getter(onMethod_ = @PropertyName("longest_streak"))
    @Setter(onMethod_ = @PropertyName("longest_streak"))
    private int longestStreak;

    /** Derived from totalPoints on every write; readers recompute it */
    private int level;

    /** Rewarded entries, all categories */
    @Getter(onMethod_ = @PropertyName("total_entries"))
    @Setter(onMethod_ = @PropertyName("total_entries"))
    private int totalEntries;

    /** Rewarded entries per WasteCategory name */
    @Builder.Default
    @Getter(onMethod_ = @PropertyName("category_counts"))
    @Setter(onMethod_ = @PropertyName("category_counts"))
    private Map<String, Integer> categoryCounts = new HashMap<>();

    /** Codes of unlocked achievements, in unlock order */
    @Builder.Default
    private List<String> achievements = new ArrayList<>();

    /** ISO date (yyyy-MM-dd), null before the first activity */
    @Getter(onMethod_ = @PropertyName("last_activity_date"))
    @Setter(onMethod_ = @PropertyName("last_activity_date"))
    private String lastActivityDate;

    @Getter(onMethod_ = @PropertyName("updated_at"))
    @Setter(onMethod_ = @PropertyName("updated_at"))
    private Timestamp updatedAt;

    public static RewardState empty(String userId) {
        return RewardState.builder()
                .userId(userId)
                .totalPoints(0)
                .currentStreak(0)
                .longestStreak(0)
                .level(1)
                .totalEntries(0)
                .build();
    }
}
