package com.lynkvertx.gridpilot.dto;

import com.lynkvertx.gridpilot.entity.PreferredAction;
import com.lynkvertx.gridpilot.policy.DecisionAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Decision for one device, and what came of it
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceDecisionDTO {

    private Long applianceId;
    private String applianceName;
    private DecisionAction action;
    private PreferredAction preferredAction;
    private String guard;
    private String reason;

    /** A device command was sent */
    private boolean applied;

    /** Command outcome; true when nothing needed sending */
    private boolean success;

    private String message;

    /** Optimistic claims lost before this decision stood */
    private int conflicts;
}
