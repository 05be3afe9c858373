package com.lynkvertx.gridpilot.adapter;

/**
 * Power-state change sent to a device
 */
public enum ActuationCommand {
    TURN_ON,
    TURN_OFF,
    ECO_ON,
    ECO_OFF
}
