package com.lynkvertx.gridpilot.dto;

import com.lynkvertx.gridpilot.entity.AutopilotStrategy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Autopilot settings and live state of a home
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutopilotStatusDTO {

    private Long homeId;
    private boolean enabled;
    private AutopilotStrategy strategy;
    private boolean gridProtectionEnabled;
    private double currentPenalty;
    private double penaltyThreshold;
    private String currentLabel;
    private int delegatedDevices;
    private int activeOverrides;
}
