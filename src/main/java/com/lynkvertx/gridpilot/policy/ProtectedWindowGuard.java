package com.lynkvertx.gridpilot.policy;

import com.lynkvertx.gridpilot.entity.DeviceAutopilotConfig;

import java.time.LocalTime;
import java.util.Optional;

/**
 * User-declared time range [start, end) in which autopilot never acts. Wraps midnight when start is after end;
 * start equal to end is an empty window.
 */
public class ProtectedWindowGuard implements AutopilotGuard {

    @Override
    public String name() {
        return "protectedWindow";
    }

    @Override
    public Optional<AutopilotDecision> evaluate(GuardContext context) {
        DeviceAutopilotConfig config = context.getConfig();
        if (!config.isProtectedWindowEnabled()
            || config.getProtectedWindowStart() == null || config.getProtectedWindowEnd() == null) {
            return Optional.empty();
        }
        LocalTime time = context.getNow().toLocalTime();
        if (contains(config.getProtectedWindowStart(), config.getProtectedWindowEnd(), time)) {
            return Optional.of(AutopilotDecision.of(DecisionAction.NOOP, name(),
                "Inside protected window " + config.getProtectedWindowStart() + "-" + config.getProtectedWindowEnd()));
        }
        return Optional.empty();
    }

    static boolean contains(LocalTime start, LocalTime end, LocalTime time) {
        if (start.equals(end)) {
            return false;
        }
        if (start.isBefore(end)) {
            return !time.isBefore(start) && time.isBefore(end);
        }
        return !time.isBefore(start) || time.isBefore(end);
    }
}
