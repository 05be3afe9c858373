package com.lynkvertx.gridpilot.policy;

import com.lynkvertx.gridpilot.entity.Appliance;
import com.lynkvertx.gridpilot.entity.DeviceAutopilotConfig;
import com.lynkvertx.gridpilot.entity.GridEvent;
import com.lynkvertx.gridpilot.entity.Home;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Everything a guard may look at for one device. Home-level values (penalty, grid event)
 * are computed once per home per tick and shared by all of its devices.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GuardContext {

    private Home home;
    private Appliance appliance;
    private DeviceAutopilotConfig config;

    /** Local wall-clock time in the configured zone */
    private LocalDateTime now;

    /** Penalty of the current hour under the home's strategy */
    private double currentPenalty;

    private double penaltyThreshold;

    /** Active critical event for the home's grid operator, or null */
    private GridEvent criticalEvent;

    /** Whether the appliance category supports eco mode / power limiting */
    private boolean ecoCapable;
}
