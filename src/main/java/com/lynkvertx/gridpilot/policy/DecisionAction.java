package com.lynkvertx.gridpilot.policy;

/**
 * Outcome of the guard chain for one device in one tick.
 */
public enum DecisionAction {

    /** Do nothing; autopilot must not touch the device */
    NOOP,

    /** Emergency grid protection: switch the device off */
    FORCE_OFF,

    /** Penalty above threshold: apply the device's preferred action */
    APPLY_PREFERRED,

    /** Penalty acceptable: leave the device as it is */
    ALLOW
}
