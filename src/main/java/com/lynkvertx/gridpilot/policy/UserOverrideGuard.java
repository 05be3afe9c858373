package com.lynkvertx.gridpilot.policy;

import java.util.Optional;

/**
 * A human took control of the device (app or physical switch); autopilot stays away until the override expires.
 * Ranked above everything, including emergency grid protection.
 */
public class UserOverrideGuard implements AutopilotGuard {

    @Override
    public String name() {
        return "userOverride";
    }

    @Override
    public Optional<AutopilotDecision> evaluate(GuardContext context) {
        if (context.getConfig().isOverrideInEffect(context.getNow())) {
            return Optional.of(AutopilotDecision.of(DecisionAction.NOOP, name(),
                "User override active until " + context.getConfig().getOverrideUntil()));
        }
        return Optional.empty();
    }
}
