package com.ecoWasteEngine.dto;

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
public class RewardStateResponseDTO {
    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("total_points")
    private long totalPoints;

    @JsonProperty("current_streak")
    private int currentStreak;

    @JsonProperty("longest_streak")
    private int longestStreak;

    private int level;

    @JsonProperty("level_name")
    private String levelName;

    @JsonProperty("points_to_next_level")
    private long pointsToNextLevel;

    @JsonProperty("total_entries")
    private int totalEntries;

    private List<String> achievements;

    @JsonProperty("last_activity_date")
    private String lastActivityDate;
}
