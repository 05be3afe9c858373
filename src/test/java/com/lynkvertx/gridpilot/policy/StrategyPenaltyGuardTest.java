package com.lynkvertx.gridpilot.policy;

import com.lynkvertx.gridpilot.entity.PreferredAction;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StrategyPenaltyGuardTest {

    private final StrategyPenaltyGuard guard = new StrategyPenaltyGuard();

    @Test
    void penaltyAboveThresholdAppliesPreferredAction() {
        AutopilotDecision decision = guard.evaluate(GuardContexts.base().build()).orElseThrow();

        assertThat(decision.getAction()).isEqualTo(DecisionAction.APPLY_PREFERRED);
        assertThat(decision.getPreferredAction()).isEqualTo(PreferredAction.ECO_MODE);
        assertThat(decision.isActing()).isTrue();
    }

    @Test
    void penaltyAtThresholdAllows() {
        AutopilotDecision decision = guard.evaluate(GuardContexts.base().currentPenalty(0.6).build()).orElseThrow();

        assertThat(decision.getAction()).isEqualTo(DecisionAction.ALLOW);
        assertThat(decision.isActing()).isFalse();
    }

    @Test
    void ecoActionFallsBackToTurnOffWithoutEcoSupport() {
        GuardContext context = GuardContexts.base().ecoCapable(false).build();
        context.getConfig().setPreferredAction(PreferredAction.LIMIT_POWER);

        AutopilotDecision decision = guard.evaluate(context).orElseThrow();

        assertThat(decision.getPreferredAction()).isEqualTo(PreferredAction.TURN_OFF);
    }

    @Test
    void delayStartIsKeptWithoutEcoSupport() {
        GuardContext context = GuardContexts.base().ecoCapable(false).build();
        context.getConfig().setPreferredAction(PreferredAction.DELAY_START);

        assertThat(guard.evaluate(context).orElseThrow().getPreferredAction()).isEqualTo(PreferredAction.DELAY_START);
    }
}
