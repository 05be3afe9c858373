package com.lynkvertx.gridpilot.calculation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One hour of a penalty timeline
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HourPenalty {

    private int hour;

    /** Strategy-weighted penalty in [0, 1] */
    private double penalty;

    /** Excellent / Good / Fair / High / Critical */
    private String label;

    private String slotType;

    /** Cost of one kWh consumed in this hour */
    private BigDecimal cost;

    /** Grams of CO2 for one kWh consumed in this hour */
    private BigDecimal carbon;

    private boolean cleanWindow;

    private boolean offPeak;
}
