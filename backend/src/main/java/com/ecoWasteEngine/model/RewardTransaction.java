package com.ecoWasteEngine.model;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.annotation.PropertyName;
import com.ecoWasteEngine.model.enums.WasteCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/** At most one per waste entry; the entry id doubles as the document id. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class RewardTransaction {
    @Getter(onMethod_ = @PropertyName("entry_id"))
    @Setter(onMethod_ = @PropertyName("entry_id"))
    private String entryId;

    @Getter(onMethod_ = @PropertyName("user_id"))
    @Setter(onMethod_ = @PropertyName("user_id"))
    private String userId;

    private WasteCategory category;

    @Getter(onMethod_ = @PropertyName("base_points"))
    @Setter(onMethod_ = @PropertyName("base_points"))
    private int basePoints;

    @Getter(onMethod_ = @PropertyName("category_bonus"))
    @Setter(onMethod_ = @PropertyName("category_bonus"))
    private int categoryBonus;

    @Getter(onMethod_ = @PropertyName("first_time_bonus"))
    @Setter(onMethod_ = @PropertyName("first_time_bonus"))
    private int firstTimeBonus;

    @Getter(onMethod_ = @PropertyName("achievement_bonus"))
    @Setter(onMethod_ = @PropertyName("achievement_bonus"))
    private int achievementBonus;

    /** Achievement codes unlocked by this entry */
    @Builder.Default
    @Getter(onMethod_ = @PropertyName("unlocked_achievements"))
    @Setter(onMethod_ = @PropertyName("unlocked_achievements"))
    private List<String> unlockedAchievements = new ArrayList<>();

    @Getter(onMethod_ = @PropertyName("streak_bonus"))
    @Setter(onMethod_ = @PropertyName("streak_bonus"))
    private int streakBonus;

    @Getter(onMethod_ = @PropertyName("points_awarded"))
    @Setter(onMethod_ = @PropertyName("points_awarded"))
    private int pointsAwarded;

    @Getter(onMethod_ = @PropertyName("streak_delta"))
    @Setter(onMethod_ = @PropertyName("streak_delta"))
    private int streakDelta;

    @Getter(onMethod_ = @PropertyName("streak_after"))
    @Setter(onMethod_ = @PropertyName("streak_after"))
    private int streakAfter;

    @Getter(onMethod_ = @PropertyName("level_after"))
    @Setter(onMethod_ = @PropertyName("level_after"))
    private int levelAfter;

    @Getter(onMethod_ = @PropertyName("created_at"))
    @Setter(onMethod_ = @PropertyName("created_at"))
    private Timestamp createdAt;
}
