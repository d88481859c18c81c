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
public class LeaderboardEntryDTO {
    private int rank;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("total_points")
    private long totalPoints;

    private int level;

    @JsonProperty("level_name")
    private String levelName;

    @JsonProperty("total_entries")
    private int totalEntries;
}
