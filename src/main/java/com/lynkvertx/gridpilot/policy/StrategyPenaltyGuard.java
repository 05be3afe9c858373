package com.lynkvertx.gridpilot.policy;

import com.lynkvertx.gridpilot.entity.PreferredAction;

import java.util.Optional;

/**
 * Last link: applies the device's preferred action when the current penalty exceeds the threshold,
 * otherwise allows. Always decides.
 */
public class StrategyPenaltyGuard implements AutopilotGuard {

    @Override
    public String name() {
        return "strategyPenalty";
    }

    @Override
    public Optional<AutopilotDecision> evaluate(GuardContext context) {
        double penalty = context.getCurrentPenalty();
        if (penalty > context.getPenaltyThreshold()) {
            PreferredAction action = context.getConfig().getPreferredAction();
            if (action.requiresEcoSupport() && !context.isEcoCapable()) {
                action = PreferredAction.TURN_OFF;
            }
            return Optional.of(AutopilotDecision.builder()
                .action(DecisionAction.APPLY_PREFERRED)
                .preferredAction(action)
                .guard(name())
                .reason(String.format("Penalty %.3f above threshold %.2f under %s",
                    penalty, context.getPenaltyThreshold(), context.getHome().getStrategy().getValue()))
                .build());
        }
        return Optional.of(AutopilotDecision.of(DecisionAction.ALLOW, name(),
            String.format("Penalty %.3f within threshold %.2f", penalty, context.getPenaltyThreshold())));
    }
}
