package com.lynkvertx.gridpilot.service;

import com.lynkvertx.gridpilot.adapter.ActuationCommand;
import com.lynkvertx.gridpilot.adapter.ActuationResult;
import com.lynkvertx.gridpilot.entity.ApplianceSchedule;
import com.lynkvertx.gridpilot.entity.RepeatType;
import com.lynkvertx.gridpilot.repository.ApplianceScheduleRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduleRunnerTest {

    /** A Monday */
    private static final LocalDateTime MONDAY_7AM = LocalDateTime.of(2024, 7, 1, 7, 0);

    @Mock
    private ApplianceScheduleRepository scheduleRepository;
    @Mock
    private ScheduleService scheduleService;
    @Mock
    private DeviceControlService deviceControl;
    @Mock
    private Clock clock;
    @InjectMocks
    private ScheduleRunner runner;

    private ApplianceSchedule schedule(RepeatType repeat, LocalDateTime lastExecuted) {
        return ApplianceSchedule.builder()
            .id(3L)
            .applianceId(10L)
            .homeId(1L)
            .startTime(LocalTime.of(7, 0))
            .endTime(LocalTime.of(8, 30))
            .repeatType(repeat)
            .active(true)
            .activeApplianceId(10L)
            .lastExecuted(lastExecuted)
            .build();
    }

    @Test
    void startMinuteTurnsApplianceOn() {
        when(scheduleRepository.findByActiveTrue()).thenReturn(Collections.singletonList(schedule(RepeatType.DAILY, null)));
        when(deviceControl.execute(10L, ActuationCommand.TURN_ON, "turn_on", AuditService.SOURCE_SCHEDULER))
            .thenReturn(ActuationResult.ok("TURN_ON applied"));

        assertThat(runner.runDueSchedules(MONDAY_7AM)).isEqualTo(1);
        verify(scheduleRepository).markExecuted(3L, MONDAY_7AM);
    }

    @Test
    void sameMinuteFiresOnlyOnce() {
        when(scheduleRepository.findByActiveTrue())
            .thenReturn(Collections.singletonList(schedule(RepeatType.DAILY, MONDAY_7AM)));

        assertThat(runner.runDueSchedules(MONDAY_7AM)).isZero();
        verify(deviceControl, never()).execute(anyLong(), any(), anyString(), anyString());
    }

    @Test
    void onceScheduleEndsOnlyAfterItStarted() {
        LocalDateTime end = MONDAY_7AM.withHour(8).withMinute(30);
        when(scheduleRepository.findByActiveTrue())
            .thenReturn(Collections.singletonList(schedule(RepeatType.ONCE, null)));

        assertThat(runner.runDueSchedules(end)).isZero();

        when(scheduleRepository.findByActiveTrue())
            .thenReturn(Collections.singletonList(schedule(RepeatType.ONCE, MONDAY_7AM)));
        when(deviceControl.execute(10L, ActuationCommand.TURN_OFF, "turn_off", AuditService.SOURCE_SCHEDULER))
            .thenReturn(ActuationResult.ok("TURN_OFF applied"));

        assertThat(runner.runDueSchedules(end)).isEqualTo(1);
    }

    @Test
    void weekendScheduleSkipsMonday() {
        when(scheduleRepository.findByActiveTrue())
            .thenReturn(Collections.singletonList(schedule(RepeatType.WEEKENDS, null)));

        assertThat(runner.runDueSchedules(MONDAY_7AM)).isZero();
    }
}
