package com.ecoWasteEngine.controller;

import com.ecoWasteEngine.dto.AchievementDTO;
import com.ecoWasteEngine.dto.RewardStateResponseDTO;
import com.ecoWasteEngine.dto.RewardTransactionDTO;
import com.ecoWasteEngine.model.RewardState;
import com.ecoWasteEngine.model.enums.Achievement;
import com.ecoWasteEngine.service.RewardCalculator;
import com.ecoWasteEngine.service.RewardLedger;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/users/{userId}")
@RequiredArgsConstructor
@Validated
public class RewardController {

    private final RewardLedger rewardLedger;
    private final RewardCalculator rewardCalculator;

    @GetMapping("/reward-state")
    public ResponseEntity<RewardStateResponseDTO> getRewardState(@PathVariable String userId) {
        RewardState state = rewardLedger.getState(userId);
        // level always follows the current thresholds, not the stored value
        int level = rewardCalculator.levelFor(state.getTotalPoints());
        return ResponseEntity.ok(RewardStateResponseDTO.builder()
                .userId(userId)
                .totalPoints(state.getTotalPoints())
                .currentStreak(state.getCurrentStreak())
                .longestStreak(state.getLongestStreak())
                .level(level)
                .levelName(rewardCalculator.levelName(level))
                .pointsToNextLevel(rewardCalculator.pointsToNextLevel(state.getTotalPoints()))
                .totalEntries(state.getTotalEntries())
                .achievements(state.getAchievements())
                .lastActivityDate(state.getLastActivityDate())
                .build());
    }

    @GetMapping("/achievements")
    public ResponseEntity<List<AchievementDTO>> getAchievements(@PathVariable String userId) {
        RewardState state = rewardLedger.getState(userId);
        List<String> unlocked = state.getAchievements() == null ? List.of() : state.getAchievements();
        List<AchievementDTO> dtos = Arrays.stream(Achievement.values())
                .map(a -> AchievementDTO.builder()
                        .code(a.name())
                        .name(a.getDisplayName())
                        .description(a.getDescription())
                        .pointsReward(a.getPointsReward())
                        .target(a.getTarget())
                        .progress(Math.min(rewardCalculator.progress(a, state), a.getTarget()))
                        .unlocked(unlocked.contains(a.name()))
                        .build())
                .collect(Collectors.toList());
        return ResponseEntity.ok(dtos);
    }

    @GetMapping("/reward-transactions")
    public ResponseEntity<List<RewardTransactionDTO>> getRewardTransactions(
            @PathVariable String userId,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit) {
        List<RewardTransactionDTO> dtos = rewardLedger.getTransactions(userId, limit).stream()
                .map(RewardTransactionDTO::fromModel)
                .collect(Collectors.toList());
        return ResponseEntity.ok(dtos);
    }
}
