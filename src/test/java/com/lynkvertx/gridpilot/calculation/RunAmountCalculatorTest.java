package com.lynkvertx.gridpilot.calculation;

import com.lynkvertx.gridpilot.entity.TariffSlot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunAmountCalculatorTest {

    private final RunAmountCalculator calculator = new RunAmountCalculator();

    @Test
    void runAcrossPeakEndIsSplitByMinutes() {
        BigDecimal cost = calculator.amount(1500, 21, 50, 1.0, ReferenceTables.eveningPeakTariff(), 2);

        assertThat(cost).isEqualTo(new BigDecimal("10.28"));
    }

    @Test
    void fullHourRunsUseHourlyRates() {
        // 2 kW from 17:00 for 3 h: 6.31 + 9.55 + 9.55 per kWh
        BigDecimal cost = calculator.amount(2000, 17, 3.0, ReferenceTables.eveningPeakTariff(), 2);

        assertThat(cost).isEqualTo(new BigDecimal("50.82"));
    }

    @Test
    void carbonTableYieldsGrams() {
        // 1 kW for 30 min at 550 g/kWh
        BigDecimal grams = calculator.amount(1000, 10, 0.5, ReferenceTables.biharCarbon(), 1);

        assertThat(grams).isEqualTo(new BigDecimal("275.0"));
    }

    @Test
    void runPastMidnightWraps() {
        BigDecimal overnight = calculator.amount(1000, 23, 2.0, ReferenceTables.biharCarbon(), 1);

        assertThat(overnight).isEqualTo(new BigDecimal("1330.0"));
    }

    @Test
    void emptyTableCostsNothing() {
        BigDecimal cost = calculator.amount(1500, 21, 50, 1.0, HourlyTariffTable.empty(), 2);

        assertThat(cost).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void invalidInputsAreRejected() {
        HourlyTariffTable table = ReferenceTables.eveningPeakTariff();

        assertThatThrownBy(() -> calculator.amount(-1, 0, 1.0, table, 2))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> calculator.amount(1000, 0, 60, 1.0, table, 2))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> calculator.amount(1000, 0, -0.5, table, 2))
            .isInstanceOf(IllegalArgumentException.class);
    }

    static LongStream seeds() {
        return LongStream.rangeClosed(1, 60);
    }

    @ParameterizedTest
    @MethodSource("seeds")
    void matchesMinuteByMinuteWalkOverRawSlots(long seed) {
        Random random = new Random(seed);
        List<TariffSlot> slots = randomPartition(random);
        HourlyTariffTable table = HourlyTariffTable.of(slots);

        int powerW = 1 + random.nextInt(5000);
        int startHour = random.nextInt(24);
        int startMinute = random.nextInt(60);
        int minutes = 1 + random.nextInt(48 * 60);

        BigDecimal expected = walk(slots, powerW, startHour, startMinute, minutes);
        BigDecimal actual = calculator.amount(powerW, startHour, startMinute, minutes / 60.0, table, 2);

        assertThat(actual).isEqualTo(expected);
    }

    /** Random gap-free day split into 1-8 slots, rotated so the last slot usually wraps midnight */
    private static List<TariffSlot> randomPartition(Random random) {
        int offset = random.nextInt(24);
        TreeSet<Integer> cuts = new TreeSet<>();
        int count = random.nextInt(8);
        while (cuts.size() < count) {
            cuts.add(1 + random.nextInt(23));
        }
        List<Integer> edges = new ArrayList<>();
        edges.add(0);
        edges.addAll(cuts);
        edges.add(24);

        List<TariffSlot> slots = new ArrayList<>();
        for (int i = 0; i + 1 < edges.size(); i++) {
            int start = (edges.get(i) + offset) % 24;
            int end = (edges.get(i + 1) + offset) % 24;
            BigDecimal rate = BigDecimal.valueOf(random.nextInt(2000), 2);
            slots.add(ReferenceTables.slot("S" + i, start, end, rate.toPlainString(), "normal"));
        }
        return slots;
    }

    private static BigDecimal walk(List<TariffSlot> slots, int powerW, int startHour, int startMinute, int minutes) {
        BigDecimal total = BigDecimal.ZERO;
        for (int m = 0; m < minutes; m++) {
            int hour = (startHour + (startMinute + m) / 60) % 24;
            total = total.add(rateFor(slots, hour));
        }
        return total.multiply(BigDecimal.valueOf(powerW))
            .divide(BigDecimal.valueOf(60_000L), 2, RoundingMode.HALF_UP);
    }

    private static BigDecimal rateFor(List<TariffSlot> slots, int hour) {
        for (TariffSlot slot : slots) {
            int start = slot.getStartHour();
            int end = slot.getEndHour();
            boolean covers;
            if (start == end) {
                covers = true;
            } else if (start < end) {
                covers = hour >= start && hour < end;
            } else {
                covers = hour >= start || hour < end;
            }
            if (covers) {
                return slot.getRate();
            }
        }
        throw new IllegalStateException("No slot covers hour " + hour);
    }
}
