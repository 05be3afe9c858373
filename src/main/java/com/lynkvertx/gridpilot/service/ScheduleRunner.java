package com.lynkvertx.gridpilot.service;

import com.lynkvertx.gridpilot.adapter.ActuationCommand;
import com.lynkvertx.gridpilot.adapter.ActuationResult;
import com.lynkvertx.gridpilot.entity.ApplianceSchedule;
import com.lynkvertx.gridpilot.entity.RepeatType;
import com.lynkvertx.gridpilot.repository.ApplianceScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;

/**
 * Fires active schedules: ON at the start minute, OFF at the end minute, on days matching the repeat rule.
 * A ONCE schedule fires its start a single time and its end only after that start.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduleRunner {

    private final ApplianceScheduleRepository scheduleRepository;
    private final ScheduleService scheduleService;
    private final DeviceControlService deviceControl;
    private final Clock clock;

    @Scheduled(cron = "0 * * * * *")
    public void tick() {
        runDueSchedules(LocalDateTime.now(clock).truncatedTo(ChronoUnit.MINUTES));
    }

    /**
     * @return number of schedule actions fired at the given minute
     */
    public int runDueSchedules(LocalDateTime minute) {
        int fired = 0;
        for (ApplianceSchedule schedule : scheduleRepository.findByActiveTrue()) {
            try {
                if (fire(schedule, minute)) {
                    fired++;
                }
            } catch (RuntimeException e) {
                log.error("Schedule {} failed at {}", schedule.getId(), minute, e);
            }
        }
        return fired;
    }

    private boolean fire(ApplianceSchedule schedule, LocalDateTime minute) {
        if (!schedule.getRepeatType().appliesOn(minute.getDayOfWeek(), scheduleService.customDays(schedule))) {
            return false;
        }
        LocalDateTime last = schedule.getLastExecuted();
        if (last != null && last.truncatedTo(ChronoUnit.MINUTES).equals(minute)) {
            return false;
        }
        LocalTime time = minute.toLocalTime();
        boolean once = schedule.getRepeatType() == RepeatType.ONCE;

        if (time.equals(schedule.getStartTime().truncatedTo(ChronoUnit.MINUTES)) && (!once || last == null)) {
            return execute(schedule, ActuationCommand.TURN_ON, "turn_on", minute);
        }
        if (schedule.getEndTime() != null && time.equals(schedule.getEndTime().truncatedTo(ChronoUnit.MINUTES))
            && (!once || startedLast(schedule, last))) {
            return execute(schedule, ActuationCommand.TURN_OFF, "turn_off", minute);
        }
        return false;
    }

    private static boolean startedLast(ApplianceSchedule schedule, LocalDateTime last) {
        return last != null
            && last.toLocalTime().truncatedTo(ChronoUnit.MINUTES).equals(schedule.getStartTime().truncatedTo(ChronoUnit.MINUTES));
    }

    private boolean execute(ApplianceSchedule schedule, ActuationCommand command, String action, LocalDateTime minute) {
        ActuationResult result = deviceControl.execute(schedule.getApplianceId(), command, action, AuditService.SOURCE_SCHEDULER);
        scheduleRepository.markExecuted(schedule.getId(), minute);
        log.info("Schedule {} fired {} for appliance {} (success={})",
            schedule.getId(), action, schedule.getApplianceId(), result.isSuccess());
        return true;
    }
}
