package com.lynkvertx.gridpilot.calculation;

import com.lynkvertx.gridpilot.entity.AutopilotStrategy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input of a window search: what runs, for how long, and from which hour the search starts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunRequest {

    private int powerW;

    private double durationHours;

    /** Current hour of day; run-now and chronological order are relative to it */
    private int fromHour;

    /** Candidate starts are limited to [fromHour, fromHour + horizonHours) */
    @Builder.Default
    private int horizonHours = 24;

    @Builder.Default
    private AutopilotStrategy strategy = AutopilotStrategy.BALANCED;

    /** Optional user-picked start hour */
    private Integer customStartHour;

    @Builder.Default
    private int costScale = 2;

    @Builder.Default
    private int carbonScale = 1;
}
