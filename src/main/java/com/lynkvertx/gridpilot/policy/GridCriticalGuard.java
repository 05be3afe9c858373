package com.lynkvertx.gridpilot.policy;

import java.util.Optional;

/**
 * Emergency grid protection: a critical event for the home's grid operator forces devices off,
 * if the home opted into grid protection.
 */
public class GridCriticalGuard implements AutopilotGuard {

    @Override
    public String name() {
        return "gridCritical";
    }

    @Override
    public Optional<AutopilotDecision> evaluate(GuardContext context) {
        if (context.getHome().isGridProtectionEnabled() && context.getCriticalEvent() != null) {
            return Optional.of(AutopilotDecision.of(DecisionAction.FORCE_OFF, name(),
                "Critical grid event: " + context.getCriticalEvent().getEventType()));
        }
        return Optional.empty();
    }
}
