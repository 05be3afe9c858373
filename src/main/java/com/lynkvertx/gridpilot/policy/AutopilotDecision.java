package com.lynkvertx.gridpilot.policy;

import com.lynkvertx.gridpilot.entity.PreferredAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Terminal decision of one guard
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutopilotDecision {

    private DecisionAction action;

    /** Concrete action for APPLY_PREFERRED, after eco fallback; null otherwise */
    private PreferredAction preferredAction;

    /** Name of the guard that decided */
    private String guard;

    private String reason;

    public static AutopilotDecision of(DecisionAction action, String guard, String reason) {
        return AutopilotDecision.builder().action(action).guard(guard).reason(reason).build();
    }

    public boolean isActing() {
        return action == DecisionAction.FORCE_OFF || action == DecisionAction.APPLY_PREFERRED;
    }
}
