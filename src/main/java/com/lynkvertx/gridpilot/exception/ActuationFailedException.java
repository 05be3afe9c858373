package com.lynkvertx.gridpilot.exception;

import lombok.Getter;

/**
 * A device did not carry out a command requested directly by a user.
 * Autopilot ticks never throw this; they record the failure and retry next tick.
 */
@Getter
public class ActuationFailedException extends RuntimeException {

    private final Long applianceId;

    public ActuationFailedException(Long applianceId, String reason) {
        super("Appliance " + applianceId + " did not respond: " + reason);
        this.applianceId = applianceId;
    }
}
