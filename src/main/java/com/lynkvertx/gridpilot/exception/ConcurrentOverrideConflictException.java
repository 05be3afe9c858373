package com.lynkvertx.gridpilot.exception;

import lombok.Getter;

/**
 * An optimistic, version-conditioned write on a device's autopilot config matched no row:
 * another tick or a user action changed the config after it was read.
 * The caller must re-read and re-evaluate instead of applying its decision.
 */
@Getter
public class ConcurrentOverrideConflictException extends RuntimeException {

    private final Long applianceId;

    public ConcurrentOverrideConflictException(Long applianceId, long expectedVersion) {
        super("Autopilot config for appliance " + applianceId
            + " changed concurrently (expected version " + expectedVersion + ")");
        this.applianceId = applianceId;
    }
}
