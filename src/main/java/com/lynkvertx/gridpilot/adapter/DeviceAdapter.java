package com.lynkvertx.gridpilot.adapter;

/**
 * Device-control layer. Implementations talk to real hardware or simulate it;
 * re-sending a command the device already satisfies must be a harmless no-op.
 */
public interface DeviceAdapter {

    ActuationResult setPower(Long applianceId, ActuationCommand command);
}
