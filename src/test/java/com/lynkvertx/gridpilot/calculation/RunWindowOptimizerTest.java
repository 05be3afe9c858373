package com.lynkvertx.gridpilot.calculation;

import com.lynkvertx.gridpilot.entity.AutopilotStrategy;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunWindowOptimizerTest {

    private final RunWindowOptimizer optimizer = new RunWindowOptimizer(new RunAmountCalculator(), new PenaltyScorer());
    private final HourlyTariffTable tariff = ReferenceTables.eveningPeakTariff();
    private final HourlyCarbonTable carbon = ReferenceTables.biharCarbon();

    private RunRequest request(int fromHour, double durationHours, AutopilotStrategy strategy) {
        return RunRequest.builder()
            .powerW(1000)
            .durationHours(durationHours)
            .fromHour(fromHour)
            .strategy(strategy)
            .build();
    }

    @Test
    void bestWindowDuringPeakIsFirstHourAfterIt() {
        ScheduleWindow best = optimizer.bestWindow(request(18, 1.0, AutopilotStrategy.MAX_SAVINGS), tariff, carbon);

        assertThat(best.getStartHour()).isEqualTo(22);
        assertThat(best.getLabel()).isEqualTo("Best Window (10:00 PM)");
        assertThat(best.getCost()).isEqualByComparingTo("6.31");
        assertThat(best.getSavingsAmount()).isEqualByComparingTo("3.24");
        assertThat(best.getSavingsPercent()).isEqualTo(34);
    }

    @Test
    void ecoStrategyPrefersCleanestHours() {
        ScheduleWindow best = optimizer.bestWindow(request(18, 2.0, AutopilotStrategy.ECO), tariff, carbon);

        assertThat(best.getStartHour()).isEqualTo(6);
        assertThat(best.getCarbon()).isEqualByComparingTo("1100.0");
    }

    @Test
    void candidatesIncludeStartsThatEndOnABoundary() {
        assertThat(optimizer.candidateStarts(request(0, 2.0, AutopilotStrategy.BALANCED), tariff, carbon))
            .contains(16, 20, 4, 14);
    }

    @Test
    void candidatesAreChronologicalFromCurrentHour() {
        assertThat(optimizer.candidateStarts(request(20, 1.0, AutopilotStrategy.BALANCED), tariff, carbon))
            .startsWith(20, 21, 22)
            .endsWith(17, 18);
    }

    @Test
    void horizonLimitsCandidates() {
        RunRequest limited = request(18, 1.0, AutopilotStrategy.MAX_SAVINGS);
        limited.setHorizonHours(3);

        ScheduleWindow best = optimizer.bestWindow(limited, tariff, carbon);

        assertThat(best.getStartHour()).isEqualTo(18);
        assertThat(best.getSavingsAmount()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void optionsOmitNextCheaperWhenItIsTheCheapest() {
        WindowOptions options = optimizer.options(request(18, 1.0, AutopilotStrategy.BALANCED), tariff, carbon);

        assertThat(options.getRunNow().getStartHour()).isEqualTo(18);
        assertThat(options.getRunNow().getCost()).isEqualByComparingTo("9.55");
        assertThat(options.getRunNow().getSavingsPercent()).isZero();
        assertThat(options.getCheapest().getStartHour()).isEqualTo(22);
        assertThat(options.getNextCheaper()).isNull();
        assertThat(options.getCustom()).isNull();
    }

    private static HourlyTariffTable threeTierTariff() {
        return HourlyTariffTable.of(Arrays.asList(
            ReferenceTables.slot("Peak", 18, 22, "9.55", "peak"),
            ReferenceTables.slot("Shoulder", 22, 2, "7.00", "normal"),
            ReferenceTables.slot("Night", 2, 18, "4.00", "off-peak")));
    }

    @Test
    void nextCheaperIsTheFirstImprovementBeforeTheCheapest() {
        WindowOptions options = optimizer.options(request(18, 1.0, AutopilotStrategy.MAX_SAVINGS),
            threeTierTariff(), carbon);

        assertThat(options.getNextCheaper().getStartHour()).isEqualTo(22);
        assertThat(options.getNextCheaper().getLabel()).isEqualTo("Run at Next Cheaper Time (10:00 PM)");
        assertThat(options.getNextCheaper().getSavingsAmount()).isEqualByComparingTo("2.55");
        assertThat(options.getCheapest().getStartHour()).isEqualTo(2);
        assertThat(options.getCheapest().getCost()).isEqualByComparingTo("4.00");
    }

    @Test
    void nextCheaperStaysWithinTheHorizon() {
        RunRequest limited = request(18, 1.0, AutopilotStrategy.MAX_SAVINGS);
        limited.setHorizonHours(3);

        WindowOptions options = optimizer.options(limited, threeTierTariff(), carbon);

        assertThat(options.getCheapest().getStartHour()).isEqualTo(18);
        assertThat(options.getNextCheaper()).isNull();
    }

    @Test
    void cheapestWindowMatchesTheCheapestOption() {
        RunRequest run = request(18, 1.0, AutopilotStrategy.ECO);

        ScheduleWindow cheapest = optimizer.cheapestWindow(run, threeTierTariff(), carbon);

        assertThat(cheapest.getStartHour()).isEqualTo(2);
        assertThat(cheapest.getLabel()).isEqualTo("Run at Cheapest Time (2:00 AM)");
        assertThat(cheapest.getSavingsAmount()).isEqualByComparingTo("5.55");
        assertThat(cheapest.getSavingsPercent()).isEqualTo(58);
        assertThat(optimizer.options(run, threeTierTariff(), carbon).getCheapest()).isEqualTo(cheapest);
    }

    @Test
    void customStartIsPricedAgainstRunNow() {
        RunRequest withCustom = request(19, 1.0, AutopilotStrategy.BALANCED);
        withCustom.setCustomStartHour(2);

        WindowOptions options = optimizer.options(withCustom, tariff, carbon);

        assertThat(options.getCustom().getLabel()).isEqualTo("Run at 2:00 AM");
        assertThat(options.getCustom().getSlotType()).isEqualTo("normal");
        assertThat(options.getCustom().getSavingsAmount()).isEqualByComparingTo("3.24");
    }

    @Test
    void customStartOutsideTheDayIsRejected() {
        RunRequest withCustom = request(19, 1.0, AutopilotStrategy.BALANCED);
        withCustom.setCustomStartHour(24);

        assertThatThrownBy(() -> optimizer.options(withCustom, tariff, carbon))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void flatTableHasNoSavings() {
        HourlyTariffTable flat = HourlyTariffTable.of(
            Collections.singletonList(ReferenceTables.slot("Flat", 0, 0, "5.00", "normal")));

        WindowOptions options = optimizer.options(request(9, 1.5, AutopilotStrategy.MAX_SAVINGS), flat,
            HourlyCarbonTable.empty());

        assertThat(options.getCheapest().getStartHour()).isEqualTo(9);
        assertThat(options.getCheapest().getCost()).isEqualByComparingTo("7.50");
        assertThat(options.getNextCheaper()).isNull();
        assertThat(options.getBest().getStartHour()).isEqualTo(9);
    }

    @Test
    void hourFormatting() {
        assertThat(RunWindowOptimizer.formatHour(0)).isEqualTo("12:00 AM");
        assertThat(RunWindowOptimizer.formatHour(12)).isEqualTo("12:00 PM");
        assertThat(RunWindowOptimizer.formatHour(22)).isEqualTo("10:00 PM");
    }
}
