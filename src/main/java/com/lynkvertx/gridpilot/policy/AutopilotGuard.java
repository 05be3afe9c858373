package com.lynkvertx.gridpilot.policy;

import java.util.Optional;

/**
 * One link of the override-precedence chain.
 * Returns a terminal decision, or empty to let the next guard decide.
 */
public interface AutopilotGuard {

    String name();

    Optional<AutopilotDecision> evaluate(GuardContext context);
}
