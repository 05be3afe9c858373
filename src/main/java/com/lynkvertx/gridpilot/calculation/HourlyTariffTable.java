package com.lynkvertx.gridpilot.calculation;

import com.lynkvertx.gridpilot.entity.TariffSlot;
import com.lynkvertx.gridpilot.exception.InvalidTimeRangeException;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Hour-indexed tariff rates of one plan.
 * Built from slots that must partition the day exactly; a slot may wrap midnight (start > end).
 */
public final class HourlyTariffTable extends HourlyTable {

    private static final HourlyTariffTable EMPTY = new HourlyTariffTable(null, null, new TreeSet<>());

    private final String[] slotTypes;

    private HourlyTariffTable(BigDecimal[] rates, String[] slotTypes, NavigableSet<Integer> boundaries) {
        super(rates, boundaries);
        this.slotTypes = slotTypes == null ? null : Arrays.copyOf(slotTypes, HOURS_PER_DAY);
    }

    public static HourlyTariffTable empty() {
        return EMPTY;
    }

    /**
     * Validate and index a plan's slots.
     *
     * @throws InvalidTimeRangeException if the slots leave a gap, overlap, or use an hour outside the day
     */
    public static HourlyTariffTable of(List<TariffSlot> slots) {
        if (slots == null || slots.isEmpty()) {
            return EMPTY;
        }
        BigDecimal[] rates = new BigDecimal[HOURS_PER_DAY];
        String[] types = new String[HOURS_PER_DAY];
        NavigableSet<Integer> boundaries = new TreeSet<>();

        for (TariffSlot slot : slots) {
            Integer start = slot.getStartHour();
            Integer end = slot.getEndHour();
            if (start == null || end == null || start < 0 || start > 23 || end < 0 || end > HOURS_PER_DAY) {
                throw new InvalidTimeRangeException(String.format(
                    "Tariff slot '%s' has hours outside the day: %s -> %s", slot.getLabel(), start, end));
            }
            if (slot.getRate() == null || slot.getRate().signum() < 0) {
                throw new IllegalArgumentException("Tariff slot '" + slot.getLabel() + "' needs a non-negative rate");
            }
            int length = Math.floorMod(end - start, HOURS_PER_DAY);
            if (length == 0) {
                length = HOURS_PER_DAY;
            }
            for (int i = 0; i < length; i++) {
                int hour = (start + i) % HOURS_PER_DAY;
                if (rates[hour] != null) {
                    throw new InvalidTimeRangeException(String.format(
                        "Tariff slots overlap at hour %d (slot '%s')", hour, slot.getLabel()));
                }
                rates[hour] = slot.getRate();
                types[hour] = slot.getSlotType();
            }
            boundaries.add(start);
        }
        for (int h = 0; h < HOURS_PER_DAY; h++) {
            if (rates[h] == null) {
                throw new InvalidTimeRangeException("Tariff slots leave hour " + h + " uncovered");
            }
        }
        return new HourlyTariffTable(rates, types, boundaries);
    }

    /** Rate per kWh for an hour */
    public BigDecimal rateAt(int hour) {
        return valueAt(hour);
    }

    public String slotTypeAt(int hour) {
        return slotTypes == null ? "normal" : slotTypes[Math.floorMod(hour, HOURS_PER_DAY)];
    }

    /** Off-peak-equivalent: rate strictly below the daily mean rate */
    public boolean isOffPeak(int hour) {
        return isBelowMean(hour);
    }
}
