package com.lynkvertx.gridpilot.service;

import com.lynkvertx.gridpilot.calculation.HourlyTariffTable;
import com.lynkvertx.gridpilot.calculation.ReferenceTables;
import com.lynkvertx.gridpilot.config.AutopilotProperties;
import com.lynkvertx.gridpilot.config.AutopilotProperties.TriggerMode;
import com.lynkvertx.gridpilot.entity.Home;
import com.lynkvertx.gridpilot.repository.HomeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AutopilotControlLoopTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-07-01T13:45:00Z"), ZoneId.of("Asia/Kolkata"));

    @Mock
    private AutopilotTickService tickService;
    @Mock
    private HomeRepository homeRepository;
    @Mock
    private ReferenceTableService referenceTables;

    private final AutopilotProperties properties = new AutopilotProperties();
    private AutopilotControlLoop loop;

    @BeforeEach
    void setUp() {
        loop = new AutopilotControlLoop(tickService, homeRepository, referenceTables, properties, CLOCK);
    }

    private void homeOnEveningPeakPlan() {
        Home home = Home.builder().id(1L).tariffPlanId("TOU-1").regionCode("IN-BR").autopilotEnabled(true).build();
        when(homeRepository.findByAutopilotEnabledTrue()).thenReturn(Collections.singletonList(home));
        when(referenceTables.tariffTable("TOU-1")).thenReturn(ReferenceTables.eveningPeakTariff());
        when(referenceTables.carbonTable("IN-BR")).thenReturn(ReferenceTables.biharCarbon());
    }

    @Test
    void intervalModeEvaluatesEveryTick() {
        loop.onTick();
        loop.onTick();

        verify(tickService, times(2)).runTick();
        verifyNoInteractions(homeRepository, referenceTables);
    }

    @Test
    void slotTransitionModeWaitsForARateOrIntensityChange() {
        properties.setTriggerMode(TriggerMode.SLOT_TRANSITION);
        homeOnEveningPeakPlan();

        assertThat(loop.shouldEvaluate(19)).as("first tick").isTrue();
        assertThat(loop.shouldEvaluate(19)).as("same hour").isFalse();
        assertThat(loop.shouldEvaluate(20)).as("still evening peak, same intensity").isFalse();
        assertThat(loop.shouldEvaluate(21)).isFalse();
        assertThat(loop.shouldEvaluate(22)).as("tariff and carbon change").isTrue();
        assertThat(loop.shouldEvaluate(23)).isFalse();
        assertThat(loop.shouldEvaluate(0)).as("carbon changes at midnight").isTrue();
        assertThat(loop.shouldEvaluate(1)).isFalse();
    }

    @Test
    void slotTransitionModeRunsTheTickOnlyOnce() {
        properties.setTriggerMode(TriggerMode.SLOT_TRANSITION);

        loop.onTick();
        loop.onTick();

        verify(tickService, times(1)).runTick();
    }

    @Test
    void unchangedValueIsNoTransition() {
        HourlyTariffTable tariff = ReferenceTables.eveningPeakTariff();

        assertThat(AutopilotControlLoop.valueChanged(tariff, 17, 18)).isTrue();
        assertThat(AutopilotControlLoop.valueChanged(tariff, 18, 21)).isFalse();
        assertThat(AutopilotControlLoop.valueChanged(HourlyTariffTable.empty(), 17, 18)).isFalse();
    }
}
