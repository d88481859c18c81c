package com.ecoWasteEngine.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ecoWasteEngine.config.WasteEngineProperties;
import com.ecoWasteEngine.dto.RewardStateResponseDTO;
import com.ecoWasteEngine.model.RewardState;
import com.ecoWasteEngine.service.RewardCalculator;
import com.ecoWasteEngine.service.RewardLedger;
import org.junit.jupiter.api.Test;

class RewardControllerTest {

    private final RewardLedger ledger = mock(RewardLedger.class);
    private final RewardCalculator calculator = new RewardCalculator(new WasteEngineProperties());
    private final RewardController controller = new RewardController(ledger, calculator);

    @Test
    void levelFollowsTotalPointsEvenWhenTheStoredLevelIsStale() {
        when(ledger.getState("u1")).thenReturn(RewardState.empty("u1").toBuilder()
                .totalPoints(350)
                .level(1)
                .build());

        RewardStateResponseDTO body = controller.getRewardState("u1").getBody();

        assertThat(body).isNotNull();
        assertThat(body.getLevel()).isEqualTo(3);
        assertThat(body.getLevelName()).isEqualTo(calculator.levelName(3));
        assertThat(body.getPointsToNextLevel()).isEqualTo(250);
    }
}
