package com.lynkvertx.gridpilot.dto;

import com.lynkvertx.gridpilot.entity.AutopilotStrategy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of evaluating one home in one tick (or a dry-run preview)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TickReportDTO {

    private Long homeId;
    private LocalDateTime evaluatedAt;
    private AutopilotStrategy strategy;
    private double penalty;
    private boolean dryRun;

    @Builder.Default
    private List<DeviceDecisionDTO> decisions = new ArrayList<>();

    /** Devices returned to their baseline in this tick */
    private int restored;

    /** Optimistic claims lost and re-evaluated */
    private int conflicts;

    private int failures;
}
