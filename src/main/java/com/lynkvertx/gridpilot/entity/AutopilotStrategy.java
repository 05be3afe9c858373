package com.lynkvertx.gridpilot.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Home-level weighting policy trading off cost against carbon.
 * Weights are (cost, carbon) and always sum to 1.
 */
public enum AutopilotStrategy {

    BALANCED("balanced", 0.7, 0.3),
    MAX_SAVINGS("maxSavings", 1.0, 0.0),
    ECO("eco", 0.0, 1.0);

    private final String value;
    private final double costWeight;
    private final double carbonWeight;

    AutopilotStrategy(String value, double costWeight, double carbonWeight) {
        this.value = value;
        this.costWeight = costWeight;
        this.carbonWeight = carbonWeight;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public double getCostWeight() {
        return costWeight;
    }

    public double getCarbonWeight() {
        return carbonWeight;
    }

    @JsonCreator
    public static AutopilotStrategy fromValue(String value) {
        return Arrays.stream(values())
            .filter(s -> s.value.equals(value) || s.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown autopilot strategy: " + value));
    }
}
