package com.lynkvertx.gridpilot.calculation;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Arrays;
import java.util.Collections;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Immutable hour-of-day lookup (24 entries) built once per plan or region version.
 * An empty table answers zero for every hour.
 */
public abstract class HourlyTable {

    public static final int HOURS_PER_DAY = 24;

    private final BigDecimal[] values;
    private final double[] doubles;
    private final BigDecimal max;
    private final BigDecimal mean;
    private final NavigableSet<Integer> boundaryHours;

    protected HourlyTable(BigDecimal[] values, NavigableSet<Integer> boundaryHours) {
        if (values == null) {
            this.values = null;
            this.doubles = new double[HOURS_PER_DAY];
            this.max = BigDecimal.ZERO;
            this.mean = BigDecimal.ZERO;
            this.boundaryHours = Collections.emptyNavigableSet();
            return;
        }
        this.values = Arrays.copyOf(values, HOURS_PER_DAY);
        this.doubles = new double[HOURS_PER_DAY];
        BigDecimal sum = BigDecimal.ZERO;
        BigDecimal top = values[0];
        for (int h = 0; h < HOURS_PER_DAY; h++) {
            doubles[h] = values[h].doubleValue();
            sum = sum.add(values[h]);
            top = top.max(values[h]);
        }
        this.max = top;
        this.mean = sum.divide(BigDecimal.valueOf(HOURS_PER_DAY), MathContext.DECIMAL64);
        this.boundaryHours = Collections.unmodifiableNavigableSet(new TreeSet<>(boundaryHours));
    }

    public boolean isEmpty() {
        return values == null;
    }

    /** Value for an hour, wrapping modulo 24 */
    public BigDecimal valueAt(int hour) {
        return values == null ? BigDecimal.ZERO : values[Math.floorMod(hour, HOURS_PER_DAY)];
    }

    public double doubleAt(int hour) {
        return doubles[Math.floorMod(hour, HOURS_PER_DAY)];
    }

    public BigDecimal max() {
        return max;
    }

    public BigDecimal mean() {
        return mean;
    }

    /**
     * Value divided by the daily maximum, in [0, 1]. Zero when the maximum is zero.
     */
    public double normalizedAt(int hour) {
        double top = max.doubleValue();
        return top > 0 ? doubleAt(hour) / top : 0.0;
    }

    /** Strictly below the 24-hour mean */
    public boolean isBelowMean(int hour) {
        return !isEmpty() && valueAt(hour).compareTo(mean) < 0;
    }

    /** Hours at which a new slot starts */
    public NavigableSet<Integer> boundaryHours() {
        return boundaryHours;
    }

    /** Hours where the value differs from the previous hour */
    protected static NavigableSet<Integer> changeHours(BigDecimal[] values) {
        NavigableSet<Integer> hours = new TreeSet<>();
        for (int h = 0; h < HOURS_PER_DAY; h++) {
            BigDecimal previous = values[Math.floorMod(h - 1, HOURS_PER_DAY)];
            if (values[h].compareTo(previous) != 0) {
                hours.add(h);
            }
        }
        return hours;
    }
}
