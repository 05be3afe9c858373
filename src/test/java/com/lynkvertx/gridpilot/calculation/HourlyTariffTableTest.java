package com.lynkvertx.gridpilot.calculation;

import com.lynkvertx.gridpilot.exception.InvalidTimeRangeException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;

import static com.lynkvertx.gridpilot.calculation.ReferenceTables.slot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HourlyTariffTableTest {

    @Test
    void wrappingSlotCoversBothSidesOfMidnight() {
        HourlyTariffTable table = HourlyTariffTable.of(Arrays.asList(
            slot("Night", 22, 6, "4.10", "off-peak"),
            slot("Day", 6, 18, "6.31", "normal"),
            slot("Peak", 18, 22, "9.55", "peak")));

        assertThat(table.rateAt(23)).isEqualByComparingTo("4.10");
        assertThat(table.rateAt(0)).isEqualByComparingTo("4.10");
        assertThat(table.rateAt(5)).isEqualByComparingTo("4.10");
        assertThat(table.rateAt(6)).isEqualByComparingTo("6.31");
        assertThat(table.rateAt(21)).isEqualByComparingTo("9.55");
        assertThat(table.slotTypeAt(2)).isEqualTo("off-peak");
        assertThat(table.boundaryHours()).containsExactly(6, 18, 22);
    }

    @Test
    void hourLookupWrapsModulo24() {
        HourlyTariffTable table = ReferenceTables.eveningPeakTariff();

        assertThat(table.rateAt(19 + 24)).isEqualByComparingTo("9.55");
        assertThat(table.rateAt(-1)).isEqualByComparingTo("6.31");
    }

    @Test
    void singleSlotWithEqualStartAndEndCoversWholeDay() {
        HourlyTariffTable table = HourlyTariffTable.of(Collections.singletonList(slot("Flat", 0, 0, "5.00", "normal")));

        for (int h = 0; h < 24; h++) {
            assertThat(table.rateAt(h)).isEqualByComparingTo("5.00");
        }
        assertThat(table.isOffPeak(3)).isFalse();
    }

    @Test
    void overlappingSlotsAreRejected() {
        assertThatThrownBy(() -> HourlyTariffTable.of(Arrays.asList(
            slot("A", 0, 12, "5.00", "normal"),
            slot("B", 10, 24, "6.00", "normal"))))
            .isInstanceOf(InvalidTimeRangeException.class)
            .hasMessageContaining("overlap");
    }

    @Test
    void gapIsRejected() {
        assertThatThrownBy(() -> HourlyTariffTable.of(Arrays.asList(
            slot("A", 0, 12, "5.00", "normal"),
            slot("B", 13, 24, "6.00", "normal"))))
            .isInstanceOf(InvalidTimeRangeException.class)
            .hasMessageContaining("hour 12");
    }

    @Test
    void hoursOutsideTheDayAreRejected() {
        assertThatThrownBy(() -> HourlyTariffTable.of(Collections.singletonList(slot("A", 24, 6, "5.00", "normal"))))
            .isInstanceOf(InvalidTimeRangeException.class);
    }

    @Test
    void negativeRateIsRejected() {
        assertThatThrownBy(() -> HourlyTariffTable.of(Collections.singletonList(slot("A", 0, 24, "-1", "normal"))))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyTableAnswersZero() {
        HourlyTariffTable table = HourlyTariffTable.of(Collections.emptyList());

        assertThat(table.isEmpty()).isTrue();
        assertThat(table.rateAt(10)).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(table.slotTypeAt(10)).isEqualTo("normal");
        assertThat(table.normalizedAt(10)).isZero();
        assertThat(table.isOffPeak(10)).isFalse();
    }

    @Test
    void offPeakMeansBelowDailyMeanRate() {
        HourlyTariffTable table = ReferenceTables.eveningPeakTariff();

        assertThat(table.isOffPeak(10)).isTrue();
        assertThat(table.isOffPeak(19)).isFalse();
        assertThat(table.max()).isEqualByComparingTo("9.55");
    }
}
