package com.lynkvertx.gridpilot.calculation;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Cost or carbon mass of running an appliance over an arbitrary time span.
 *
 * The run is split at hour boundaries; each piece contributes (minutes x hourly value),
 * and the sum is converted to kWh-weighted units and rounded once at the end.
 * Against a tariff table the result is money; against a carbon table it is grams of CO2.
 */
@Component
public class RunAmountCalculator {

    private static final BigDecimal WATT_MINUTES_PER_KWH = BigDecimal.valueOf(60_000L);

    /**
     * @param powerW        appliance draw in watts
     * @param startHour     hour of day the run starts (any int, wrapped modulo 24)
     * @param startMinute   minute within the start hour, 0-59
     * @param durationHours run length in hours, may be fractional
     * @param table         tariff or carbon lookup; an empty table yields zero
     * @param scale         decimal places of the result (half-up)
     */
    public BigDecimal amount(int powerW, int startHour, int startMinute, double durationHours,
                             HourlyTable table, int scale) {
        return exactAmount(powerW, startHour, startMinute, toMinutes(durationHours), table)
            .setScale(scale, RoundingMode.HALF_UP);
    }

    public BigDecimal amount(int powerW, int startHour, double durationHours, HourlyTable table, int scale) {
        return amount(powerW, startHour, 0, durationHours, table, scale);
    }

    /**
     * Unrounded amount for a run of whole minutes; used for comparisons between windows.
     */
    public BigDecimal exactAmount(int powerW, int startHour, int startMinute, long durationMinutes,
                                  HourlyTable table) {
        if (powerW < 0) {
            throw new IllegalArgumentException("Power must be non-negative: " + powerW);
        }
        if (startMinute < 0 || startMinute > 59) {
            throw new IllegalArgumentException("Start minute must be within 0-59: " + startMinute);
        }
        if (durationMinutes < 0) {
            throw new IllegalArgumentException("Duration must be non-negative");
        }
        if (table == null || table.isEmpty() || durationMinutes == 0 || powerW == 0) {
            return BigDecimal.ZERO;
        }

        BigDecimal valueMinutes = BigDecimal.ZERO;
        long remaining = durationMinutes;
        int hour = startHour;
        int minute = startMinute;
        while (remaining > 0) {
            long piece = Math.min(60 - minute, remaining);
            valueMinutes = valueMinutes.add(table.valueAt(hour).multiply(BigDecimal.valueOf(piece)));
            remaining -= piece;
            hour = Math.floorMod(hour + 1, HourlyTable.HOURS_PER_DAY);
            minute = 0;
        }
        return valueMinutes.multiply(BigDecimal.valueOf(powerW))
            .divide(WATT_MINUTES_PER_KWH, 12, RoundingMode.HALF_UP);
    }

    /** Whole minutes in a fractional-hour duration */
    public static long toMinutes(double durationHours) {
        if (Double.isNaN(durationHours) || durationHours < 0) {
            throw new IllegalArgumentException("Duration must be a non-negative number of hours");
        }
        return Math.round(durationHours * 60);
    }
}
