package com.ecoWasteEngine.dto;

import com.ecoWasteEngine.model.RewardTransaction;
import com.ecoWasteEngine.model.enums.WasteCategory;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RewardTransactionDTO {
    @JsonProperty("entry_id")
    private String entryId;

    private WasteCategory category;

    @JsonProperty("points_awarded")
    private int pointsAwarded;

    @JsonProperty("base_points")
    private int basePoints;

    @JsonProperty("category_bonus")
    private int categoryBonus;

    @JsonProperty("first_time_bonus")
    private int firstTimeBonus;

    @JsonProperty("streak_bonus")
    private int streakBonus;

    @JsonProperty("achievement_bonus")
    private int achievementBonus;

    @JsonProperty("unlocked_achievements")
    private List<String> unlockedAchievements;

    @JsonProperty("streak_delta")
    private int streakDelta;

    @JsonProperty("level_after")
    private int levelAfter;

    @JsonProperty("created_at")
    private String createdAt;

    public static RewardTransactionDTO fromModel(RewardTransaction tx) {
        if (tx == null)
            return null;
        return RewardTransactionDTO.builder()
                .entryId(tx.getEntryId())
                .category(tx.getCategory())
                .pointsAwarded(tx.getPointsAwarded())
                .basePoints(tx.getBasePoints())
                .categoryBonus(tx.getCategoryBonus())
                .firstTimeBonus(tx.getFirstTimeBonus())
                .streakBonus(tx.getStreakBonus())
                .achievementBonus(tx.getAchievementBonus())
                .unlockedAchievements(tx.getUnlockedAchievements())
                .streakDelta(tx.getStreakDelta())
                .levelAfter(tx.getLevelAfter())
                .createdAt(DtoTimes.format(tx.getCreatedAt()))
                .build();
    }
}
