package com.ecoWasteEngine.controller;

import com.ecoWasteEngine.dto.LeaderboardEntryDTO;
import com.ecoWasteEngine.model.RewardState;
import com.ecoWasteEngine.service.RewardCalculator;
import com.ecoWasteEngine.service.RewardLedger;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/v1/leaderboard")
@RequiredArgsConstructor
@Validated
public class LeaderboardController {

    private final RewardLedger rewardLedger;
    private final RewardCalculator rewardCalculator;

    @GetMapping
    public ResponseEntity<List<LeaderboardEntryDTO>> getLeaderboard(
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit) {
        List<LeaderboardEntryDTO> ranking = new ArrayList<>();
        for (RewardState state : rewardLedger.getLeaderboard(limit)) {
            int level = rewardCalculator.levelFor(state.getTotalPoints());
            ranking.add(LeaderboardEntryDTO.builder()
                    .rank(ranking.size() + 1)
                    .userId(state.getUserId())
                    .totalPoints(state.getTotalPoints())
                    .level(level)
                    .levelName(rewardCalculator.levelName(level))
                    .totalEntries(state.getTotalEntries())
                    .build());
        }
        return ResponseEntity.ok(ranking);
    }
}
