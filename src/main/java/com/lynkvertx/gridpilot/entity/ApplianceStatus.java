package com.lynkvertx.gridpilot.entity;

public enum ApplianceStatus {
    ON,
    OFF,
    WARNING,
    SCHEDULED;

    /** ON and WARNING both mean the appliance is drawing power */
    public boolean isRunning() {
        return this == ON || this == WARNING;
    }
}
