package com.lynkvertx.gridpilot.calculation;

import com.lynkvertx.gridpilot.entity.AutopilotStrategy;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Strategy-weighted hourly penalty.
 *
 * <pre>
 *   normCost   = rate(hour) / max(rate over the day)
 *   normCarbon = intensity(hour) / max(intensity over the day)
 *   penalty    = wCost * normCost + wCarbon * normCarbon
 * </pre>
 * A table with a zero (or missing) maximum contributes zero.
 */
@Component
public class PenaltyScorer {

    public double penalty(int hour, HourlyTariffTable tariff, HourlyCarbonTable carbon,
                          AutopilotStrategy strategy) {
        double score = strategy.getCostWeight() * tariff.normalizedAt(hour)
            + strategy.getCarbonWeight() * carbon.normalizedAt(hour);
        return Math.min(1.0, Math.max(0.0, score));
    }

    /**
     * Minute-weighted mean penalty over a run.
     */
    public double windowPenalty(int startHour, int startMinute, long durationMinutes,
                                HourlyTariffTable tariff, HourlyCarbonTable carbon, AutopilotStrategy strategy) {
        if (durationMinutes <= 0) {
            return penalty(startHour, tariff, carbon, strategy);
        }
        double weighted = 0;
        long remaining = durationMinutes;
        int hour = startHour;
        int minute = startMinute;
        while (remaining > 0) {
            long piece = Math.min(60 - minute, remaining);
            weighted += piece * penalty(hour, tariff, carbon, strategy);
            remaining -= piece;
            hour++;
            minute = 0;
        }
        return weighted / durationMinutes;
    }

    public String label(double penalty, double threshold) {
        if (penalty < 0.3) {
            return "Excellent";
        }
        if (penalty < 0.5) {
            return "Good";
        }
        if (penalty < threshold) {
            return "Fair";
        }
        if (penalty < 0.8) {
            return "High";
        }
        return "Critical";
    }

    /**
     * Penalty and per-kWh cost/carbon for each hour 0-23.
     */
    public List<HourPenalty> timeline(HourlyTariffTable tariff, HourlyCarbonTable carbon,
                                      AutopilotStrategy strategy, double threshold, int costScale, int carbonScale) {
        List<HourPenalty> hours = new ArrayList<>(HourlyTable.HOURS_PER_DAY);
        for (int h = 0; h < HourlyTable.HOURS_PER_DAY; h++) {
            double p = penalty(h, tariff, carbon, strategy);
            hours.add(HourPenalty.builder()
                .hour(h)
                .penalty(BigDecimal.valueOf(p).setScale(4, RoundingMode.HALF_UP).doubleValue())
                .label(label(p, threshold))
                .slotType(tariff.slotTypeAt(h))
                .cost(tariff.rateAt(h).setScale(costScale, RoundingMode.HALF_UP))
                .carbon(carbon.intensityAt(h).setScale(carbonScale, RoundingMode.HALF_UP))
                .cleanWindow(carbon.isCleanWindow(h))
                .offPeak(tariff.isOffPeak(h))
                .build());
        }
        return hours;
    }
}
