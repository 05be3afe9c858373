package com.lynkvertx.gridpilot.service;

import com.lynkvertx.gridpilot.calculation.HourlyTable;
import com.lynkvertx.gridpilot.config.AutopilotProperties;
import com.lynkvertx.gridpilot.config.AutopilotProperties.TriggerMode;
import com.lynkvertx.gridpilot.entity.Home;
import com.lynkvertx.gridpilot.repository.HomeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodic trigger of the autopilot.
 * INTERVAL mode evaluates on every tick. SLOT_TRANSITION evaluates on the first tick and then only
 * when the hour changes and, for some autopilot home, the tariff rate or carbon intensity of the
 * new hour differs from the previous one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AutopilotControlLoop {

    private final AutopilotTickService tickService;
    private final HomeRepository homeRepository;
    private final ReferenceTableService referenceTables;
    private final AutopilotProperties properties;
    private final Clock clock;
    private final AtomicInteger lastHour = new AtomicInteger(-1);

    @Scheduled(fixedDelayString = "${gridpilot.autopilot.tick-interval-ms:60000}",
        initialDelayString = "${gridpilot.autopilot.tick-interval-ms:60000}")
    public void onTick() {
        if (shouldEvaluate(LocalDateTime.now(clock).getHour())) {
            tickService.runTick();
        }
    }

    boolean shouldEvaluate(int hour) {
        int previous = lastHour.getAndSet(hour);
        if (properties.getTriggerMode() == TriggerMode.INTERVAL) {
            return true;
        }
        if (previous == hour) {
            return false;
        }
        if (previous < 0) {
            return true;
        }
        boolean transition = slotChanged(previous, hour);
        log.debug("Hour changed {} -> {}; slot transition: {}", previous, hour, transition);
        return transition;
    }

    private boolean slotChanged(int previous, int hour) {
        for (Home home : homeRepository.findByAutopilotEnabledTrue()) {
            if (valueChanged(referenceTables.tariffTable(home.getTariffPlanId()), previous, hour)
                || valueChanged(referenceTables.carbonTable(home.getRegionCode()), previous, hour)) {
                return true;
            }
        }
        return false;
    }

    static boolean valueChanged(HourlyTable table, int previous, int hour) {
        return table.valueAt(previous).compareTo(table.valueAt(hour)) != 0;
    }
}
