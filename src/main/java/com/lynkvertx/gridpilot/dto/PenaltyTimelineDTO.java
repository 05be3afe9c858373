package com.lynkvertx.gridpilot.dto;

import com.lynkvertx.gridpilot.calculation.HourPenalty;
import com.lynkvertx.gridpilot.entity.AutopilotStrategy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 24-hour penalty timeline of a home.
 * stale is set when the latest recomputation failed and this is the last good result.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PenaltyTimelineDTO {

    private Long homeId;
    private AutopilotStrategy strategy;
    private double penaltyThreshold;
    private int currentHour;
    private List<HourPenalty> hours;
    private LocalDateTime computedAt;
    private boolean stale;
}
