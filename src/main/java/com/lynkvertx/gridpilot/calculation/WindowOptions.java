package com.lynkvertx.gridpilot.calculation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Start-time choices for one run.
 * nextCheaper is the first later start cheaper than now, or null when that start is the cheapest one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WindowOptions {

    private ScheduleWindow runNow;
    private ScheduleWindow nextCheaper;
    private ScheduleWindow cheapest;
    private ScheduleWindow best;
    private ScheduleWindow custom;
}
