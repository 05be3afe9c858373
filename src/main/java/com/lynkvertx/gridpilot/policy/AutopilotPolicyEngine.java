package com.lynkvertx.gridpilot.policy;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered guard chain; the first guard that decides is terminal for the tick.
 *
 * <ol>
 *   <li>user / physical override</li>
 *   <li>protected window</li>
 *   <li>grid protection (critical event)</li>
 *   <li>strategy penalty</li>
 * </ol>
 */
@Component
public class AutopilotPolicyEngine {

    private final List<AutopilotGuard> guards;

    public AutopilotPolicyEngine() {
        this(Arrays.asList(
            new UserOverrideGuard(),
            new ProtectedWindowGuard(),
            new GridCriticalGuard(),
            new StrategyPenaltyGuard()));
    }

    AutopilotPolicyEngine(List<AutopilotGuard> guards) {
        this.guards = Collections.unmodifiableList(guards);
    }

    public AutopilotDecision decide(GuardContext context) {
        for (AutopilotGuard guard : guards) {
            Optional<AutopilotDecision> decision = guard.evaluate(context);
            if (decision.isPresent()) {
                return decision.get();
            }
        }
        return AutopilotDecision.of(DecisionAction.ALLOW, "none", "No guard matched");
    }

    public List<AutopilotGuard> getGuards() {
        return guards;
    }
}
