package com.lynkvertx.gridpilot.calculation;

import com.lynkvertx.gridpilot.entity.CarbonIntensity;
import com.lynkvertx.gridpilot.exception.InvalidTimeRangeException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Hour-indexed grid carbon intensity (gCO2/kWh) of one region.
 * Per hour, the active row with the latest effective date wins.
 */
public final class HourlyCarbonTable extends HourlyTable {

    private static final HourlyCarbonTable EMPTY = new HourlyCarbonTable(null);

    private HourlyCarbonTable(BigDecimal[] intensities) {
        super(intensities, intensities == null ? new TreeSet<>() : changeHours(intensities));
    }

    public static HourlyCarbonTable empty() {
        return EMPTY;
    }

    /**
     * @throws InvalidTimeRangeException if an hour is outside the day, or the active rows leave hours uncovered
     */
    public static HourlyCarbonTable of(List<CarbonIntensity> rows) {
        if (rows == null || rows.isEmpty()) {
            return EMPTY;
        }
        BigDecimal[] intensities = new BigDecimal[HOURS_PER_DAY];
        LocalDate[] effective = new LocalDate[HOURS_PER_DAY];
        boolean anyActive = false;

        for (CarbonIntensity row : rows) {
            Integer hour = row.getHourOfDay();
            if (hour == null || hour < 0 || hour > 23) {
                throw new InvalidTimeRangeException("Carbon intensity row has hour outside the day: " + hour);
            }
            if (row.getIntensity() == null || row.getIntensity().signum() < 0) {
                throw new IllegalArgumentException("Carbon intensity for hour " + hour + " must be non-negative");
            }
            if (!row.isActive()) {
                continue;
            }
            anyActive = true;
            LocalDate from = row.getEffectiveFrom() != null ? row.getEffectiveFrom() : LocalDate.MIN;
            if (intensities[hour] == null || from.isAfter(effective[hour])) {
                intensities[hour] = row.getIntensity();
                effective[hour] = from;
            }
        }
        if (!anyActive) {
            return EMPTY;
        }
        for (int h = 0; h < HOURS_PER_DAY; h++) {
            if (intensities[h] == null) {
                throw new InvalidTimeRangeException("Carbon profile leaves hour " + h + " uncovered");
            }
        }
        return new HourlyCarbonTable(intensities);
    }

    public BigDecimal intensityAt(int hour) {
        return valueAt(hour);
    }

    /** Clean window: intensity strictly below the daily mean */
    public boolean isCleanWindow(int hour) {
        return isBelowMean(hour);
    }

    /** The n lowest-intensity hours, earliest first among equals */
    public List<Integer> cleanestHours(int n) {
        if (isEmpty()) {
            return new ArrayList<>();
        }
        return IntStream.range(0, HOURS_PER_DAY).boxed()
            .sorted(Comparator.comparing((Integer h) -> valueAt(h)).thenComparing(Comparator.naturalOrder()))
            .limit(n)
            .collect(Collectors.toList());
    }
}
