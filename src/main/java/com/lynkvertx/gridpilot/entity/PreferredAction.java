package com.lynkvertx.gridpilot.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * What autopilot does to a delegated device during a penalty window.
 */
public enum PreferredAction {

    TURN_OFF("turnOff"),
    ECO_MODE("ecoMode"),
    DELAY_START("delayStart"),
    LIMIT_POWER("limitPower");

    private final String value;

    PreferredAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Actions that need eco-mode support on the appliance */
    public boolean requiresEcoSupport() {
        return this == ECO_MODE || this == LIMIT_POWER;
    }

    @JsonCreator
    public static PreferredAction fromValue(String value) {
        return Arrays.stream(values())
            .filter(a -> a.value.equals(value) || a.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown preferred action: " + value));
    }
}
