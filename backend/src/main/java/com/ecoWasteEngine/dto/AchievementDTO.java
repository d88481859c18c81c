package com.ecoWasteEngine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AchievementDTO {
    private String code;
    private String name;
    private String description;

    @JsonProperty("points_reward")
    private int pointsReward;

    private long progress;
    private long target;
    private boolean unlocked;
}
