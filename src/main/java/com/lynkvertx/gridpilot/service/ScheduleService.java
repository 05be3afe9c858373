package com.lynkvertx.gridpilot.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lynkvertx.gridpilot.dto.ScheduleDTO;
import com.lynkvertx.gridpilot.dto.ScheduleRequestDTO;
import com.lynkvertx.gridpilot.entity.Appliance;
import com.lynkvertx.gridpilot.entity.ApplianceSchedule;
import com.lynkvertx.gridpilot.entity.RepeatType;
import com.lynkvertx.gridpilot.repository.ApplianceRepository;
import com.lynkvertx.gridpilot.repository.ApplianceScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import javax.persistence.EntityNotFoundException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Appliance schedules. At most one schedule per appliance is active.
 *
 * Replacing a schedule locks the appliance row, retires the active schedule and inserts the new one
 * in a single transaction; the unique active_appliance_id column rejects a second active row even if
 * the lock were bypassed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleService {

    private final ApplianceScheduleRepository scheduleRepository;
    private final ApplianceRepository applianceRepository;
    private final ObjectMapper objectMapper;

    @Transactional
    public ScheduleDTO setSchedule(Long applianceId, ScheduleRequestDTO request) {
        Appliance appliance = applianceRepository.findByIdForUpdate(applianceId)
            .orElseThrow(() -> new EntityNotFoundException("Appliance not found with id: " + applianceId));

        RepeatType repeat = request.getRepeatType() != null ? request.getRepeatType() : RepeatType.ONCE;
        if (request.getEndTime() != null && request.getEndTime().equals(request.getStartTime())) {
            throw new IllegalArgumentException("Schedule start and end time must differ");
        }
        List<Integer> customDays = request.getCustomDays() != null
            ? new ArrayList<>(new TreeSet<>(request.getCustomDays()))
            : Collections.emptyList();
        if (repeat == RepeatType.CUSTOM && customDays.isEmpty()) {
            throw new IllegalArgumentException("Custom repeat needs at least one day (1 = Monday .. 7 = Sunday)");
        }
        String customDaysJson;
        try {
            customDaysJson = customDays.isEmpty() ? null : objectMapper.writeValueAsString(customDays);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize custom days: " + e.getMessage());
        }

        int retired = scheduleRepository.retireActive(applianceId);
        ApplianceSchedule saved = scheduleRepository.saveAndFlush(ApplianceSchedule.builder()
            .applianceId(applianceId)
            .homeId(appliance.getHomeId())
            .startTime(request.getStartTime())
            .endTime(request.getEndTime())
            .repeatType(repeat)
            .customDays(customDaysJson)
            .active(true)
            .activeApplianceId(applianceId)
            .createdBy(request.getCreatedBy() != null ? request.getCreatedBy() : "user")
            .build());

        log.info("Schedule {} set for appliance {} ({} {}-{}), retired {}", saved.getId(), applianceId,
            repeat, saved.getStartTime(), saved.getEndTime(), retired);
        return toDTO(saved);
    }

    public ScheduleDTO getActiveSchedule(Long applianceId) {
        return scheduleRepository.findByApplianceIdAndActiveTrue(applianceId)
            .map(this::toDTO)
            .orElseThrow(() -> new EntityNotFoundException("No active schedule for appliance: " + applianceId));
    }

    List<Integer> customDays(ApplianceSchedule schedule) {
        if (schedule.getCustomDays() == null) {
            return Collections.emptyList();
        }
        try {
            return objectMapper.readValue(schedule.getCustomDays(), new TypeReference<List<Integer>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize custom days for schedule {}: {}", schedule.getId(), e.getMessage());
            return Collections.emptyList();
        }
    }

    private ScheduleDTO toDTO(ApplianceSchedule entity) {
        return ScheduleDTO.builder()
            .id(entity.getId())
            .applianceId(entity.getApplianceId())
            .homeId(entity.getHomeId())
            .startTime(entity.getStartTime())
            .endTime(entity.getEndTime())
            .repeatType(entity.getRepeatType())
            .customDays(customDays(entity))
            .active(entity.isActive())
            .lastExecuted(entity.getLastExecuted())
            .createdBy(entity.getCreatedBy())
            .createdAt(entity.getCreatedAt())
            .build();
    }
}
