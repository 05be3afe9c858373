package com.lynkvertx.gridpilot.calculation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * A candidate start time for a run, priced against the tariff and carbon tables.
 * Savings are relative to starting the same run now.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleWindow {

    private String label;
    private int startHour;
    private String slotType;

    /** Tariff rate at the start hour */
    private BigDecimal rate;

    /** Minute-weighted mean penalty over the run */
    private double penalty;

    private BigDecimal cost;

    /** Grams of CO2 */
    private BigDecimal carbon;

    private BigDecimal savingsAmount;
    private int savingsPercent;
}
