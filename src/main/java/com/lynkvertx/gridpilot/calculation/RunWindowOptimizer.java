package com.lynkvertx.gridpilot.calculation;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Finds start hours for a contiguous run.
 *
 * Cost and penalty only change where the run's start or end crosses a slot boundary, so the
 * candidate starts are the boundary hours of both tables, the starts whose run ends on a boundary,
 * and the current hour. Ties go to the chronologically earliest candidate after the current hour.
 */
@Component
@RequiredArgsConstructor
public class RunWindowOptimizer {

    private static final double EPSILON = 1e-9;

    private final RunAmountCalculator calculator;
    private final PenaltyScorer scorer;

    /**
     * Lowest-penalty start within the request's horizon.
     */
    public ScheduleWindow bestWindow(RunRequest request, HourlyTariffTable tariff, HourlyCarbonTable carbon) {
        Priced runNow = price(request.getFromHour(), request, tariff, carbon);
        Priced best = null;
        for (int start : candidateStarts(request, tariff, carbon)) {
            Priced candidate = price(start, request, tariff, carbon);
            if (best == null || candidate.penalty < best.penalty - EPSILON) {
                best = candidate;
            }
        }
        return toWindow("Best Window (" + formatHour(best.start) + ")", best, runNow, request, tariff);
    }

    /**
     * Absolute-cheapest start within the request's horizon.
     */
    public ScheduleWindow cheapestWindow(RunRequest request, HourlyTariffTable tariff, HourlyCarbonTable carbon) {
        Priced runNow = price(request.getFromHour(), request, tariff, carbon);
        Priced cheapest = cheapest(request, tariff, carbon);
        return toWindow("Run at Cheapest Time (" + formatHour(cheapest.start) + ")", cheapest, runNow, request, tariff);
    }

    /**
     * Run-now, next cheaper, cheapest, best and (if requested) custom start.
     */
    public WindowOptions options(RunRequest request, HourlyTariffTable tariff, HourlyCarbonTable carbon) {
        int from = Math.floorMod(request.getFromHour(), HourlyTable.HOURS_PER_DAY);
        Priced runNow = price(from, request, tariff, carbon);
        Priced cheapest = cheapest(request, tariff, carbon);

        Priced nextCheaper = null;
        for (int offset = 1; offset < horizon(request); offset++) {
            Priced candidate = price(from + offset, request, tariff, carbon);
            if (candidate.exactCost.compareTo(runNow.exactCost) < 0) {
                nextCheaper = candidate;
                break;
            }
        }
        if (nextCheaper != null && nextCheaper.start == cheapest.start) {
            nextCheaper = null;
        }

        ScheduleWindow custom = null;
        if (request.getCustomStartHour() != null) {
            int hour = request.getCustomStartHour();
            if (hour < 0 || hour > 23) {
                throw new IllegalArgumentException("Custom start hour must be within 0-23: " + hour);
            }
            custom = toWindow("Run at " + formatHour(hour), price(hour, request, tariff, carbon), runNow, request, tariff);
        }

        return WindowOptions.builder()
            .runNow(toWindow("Run Now", runNow, runNow, request, tariff))
            .nextCheaper(nextCheaper == null ? null
                : toWindow("Run at Next Cheaper Time (" + formatHour(nextCheaper.start) + ")",
                    nextCheaper, runNow, request, tariff))
            .cheapest(cheapestWindow(request, tariff, carbon))
            .best(bestWindow(request, tariff, carbon))
            .custom(custom)
            .build();
    }

    private Priced cheapest(RunRequest request, HourlyTariffTable tariff, HourlyCarbonTable carbon) {
        Priced cheapest = null;
        for (int start : candidateStarts(request, tariff, carbon)) {
            Priced candidate = price(start, request, tariff, carbon);
            if (cheapest == null || candidate.exactCost.compareTo(cheapest.exactCost) < 0) {
                cheapest = candidate;
            }
        }
        return cheapest;
    }

    /**
     * Candidate start hours in chronological order from the request's current hour.
     */
    List<Integer> candidateStarts(RunRequest request, HourlyTariffTable tariff, HourlyCarbonTable carbon) {
        int from = Math.floorMod(request.getFromHour(), HourlyTable.HOURS_PER_DAY);
        int horizon = horizon(request);
        long minutes = RunAmountCalculator.toMinutes(request.getDurationHours());
        int shorter = (int) (minutes / 60);
        int longer = (int) ((minutes + 59) / 60);

        Set<Integer> boundaries = new TreeSet<>(tariff.boundaryHours());
        boundaries.addAll(carbon.boundaryHours());

        Set<Integer> starts = new TreeSet<>();
        starts.add(from);
        for (int boundary : boundaries) {
            starts.add(boundary);
            starts.add(Math.floorMod(boundary - shorter, HourlyTable.HOURS_PER_DAY));
            starts.add(Math.floorMod(boundary - longer, HourlyTable.HOURS_PER_DAY));
        }
        return starts.stream()
            .map(h -> Math.floorMod(h - from, HourlyTable.HOURS_PER_DAY))
            .filter(offset -> offset < horizon)
            .sorted()
            .map(offset -> (from + offset) % HourlyTable.HOURS_PER_DAY)
            .collect(Collectors.toList());
    }

    private static int horizon(RunRequest request) {
        return Math.max(1, Math.min(request.getHorizonHours(), HourlyTable.HOURS_PER_DAY));
    }

    private Priced price(int startHour, RunRequest request, HourlyTariffTable tariff, HourlyCarbonTable carbon) {
        int start = Math.floorMod(startHour, HourlyTable.HOURS_PER_DAY);
        long minutes = RunAmountCalculator.toMinutes(request.getDurationHours());
        Priced priced = new Priced();
        priced.start = start;
        priced.exactCost = calculator.exactAmount(request.getPowerW(), start, 0, minutes, tariff);
        priced.exactCarbon = calculator.exactAmount(request.getPowerW(), start, 0, minutes, carbon);
        priced.penalty = scorer.windowPenalty(start, 0, minutes, tariff, carbon, request.getStrategy());
        return priced;
    }

    private ScheduleWindow toWindow(String label, Priced window, Priced runNow, RunRequest request,
                                    HourlyTariffTable tariff) {
        BigDecimal cost = window.exactCost.setScale(request.getCostScale(), RoundingMode.HALF_UP);
        BigDecimal runNowCost = runNow.exactCost.setScale(request.getCostScale(), RoundingMode.HALF_UP);
        BigDecimal savings = runNowCost.subtract(cost);
        int percent = runNowCost.signum() > 0
            ? savings.multiply(BigDecimal.valueOf(100)).divide(runNowCost, 0, RoundingMode.HALF_UP).intValue()
            : 0;
        return ScheduleWindow.builder()
            .label(label)
            .startHour(window.start)
            .slotType(tariff.slotTypeAt(window.start))
            .rate(tariff.rateAt(window.start))
            .penalty(BigDecimal.valueOf(window.penalty).setScale(4, RoundingMode.HALF_UP).doubleValue())
            .cost(cost)
            .carbon(window.exactCarbon.setScale(request.getCarbonScale(), RoundingMode.HALF_UP))
            .savingsAmount(savings)
            .savingsPercent(percent)
            .build();
    }

    /** 22 -> "10:00 PM", 0 -> "12:00 AM" */
    static String formatHour(int hour) {
        int h = Math.floorMod(hour, HourlyTable.HOURS_PER_DAY);
        String suffix = h >= 12 ? "PM" : "AM";
        int display = h == 0 ? 12 : (h > 12 ? h - 12 : h);
        return display + ":00 " + suffix;
    }

    private static class Priced {
        int start;
        BigDecimal exactCost;
        BigDecimal exactCarbon;
        double penalty;
    }
}
