package com.lynkvertx.gridpilot.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lynkvertx.gridpilot.adapter.GridDataSource;
import com.lynkvertx.gridpilot.adapter.GridReading;
import com.lynkvertx.gridpilot.dto.GridEventDTO;
import com.lynkvertx.gridpilot.dto.GridStatusDTO;
import com.lynkvertx.gridpilot.entity.GridEvent;
import com.lynkvertx.gridpilot.entity.GridSeverity;
import com.lynkvertx.gridpilot.repository.GridEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Grid events and grid status per operator (DISCOM).
 * Stored events past their end time are expired on read.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GridProtectionService {

    private final GridEventRepository gridEventRepository;
    private final GridDataSource gridDataSource;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional
    public GridEventDTO ingestEvent(GridEventDTO dto) {
        LocalDateTime start = dto.getStartTime() != null ? dto.getStartTime() : LocalDateTime.now(clock);
        if (dto.getEndTime() != null && !dto.getEndTime().isAfter(start)) {
            throw new IllegalArgumentException("Grid event must end after it starts");
        }
        String areasJson;
        try {
            areasJson = dto.getAffectedAreas() != null ? objectMapper.writeValueAsString(dto.getAffectedAreas()) : null;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize affected areas: " + e.getMessage());
        }
        GridEvent saved = gridEventRepository.save(GridEvent.builder()
            .discomId(dto.getDiscomId())
            .eventType(dto.getEventType())
            .severity(dto.getSeverity())
            .message(dto.getMessage())
            .startTime(start)
            .endTime(dto.getEndTime())
            .affectedAreas(areasJson)
            .active(dto.getActive() == null || dto.getActive())
            .build());
        log.info("Grid event {} ({}, {}) recorded for {} from {} to {}",
            saved.getId(), saved.getEventType(), saved.getSeverity(), saved.getDiscomId(),
            saved.getStartTime(), saved.getEndTime());
        return toDTO(saved);
    }

    public GridStatusDTO getStatus(String discomId) {
        LocalDateTime now = LocalDateTime.now(clock);
        GridReading reading = gridDataSource.getStatus(discomId);
        List<GridEvent> events = activeEvents(discomId, now);

        boolean critical = events.stream().anyMatch(e -> e.getSeverity() == GridSeverity.CRITICAL);
        boolean warning = events.stream().anyMatch(e -> e.getSeverity() == GridSeverity.WARNING);
        String status = reading.getStatus() != null ? reading.getStatus() : GridStatusDTO.NORMAL;
        if (critical) {
            status = GridStatusDTO.CRITICAL;
        } else if (warning && GridStatusDTO.NORMAL.equals(status)) {
            status = GridStatusDTO.STRESSED;
        }

        return GridStatusDTO.builder()
            .discomId(discomId)
            .status(status)
            .frequencyHz(reading.getFrequencyHz())
            .voltageV(reading.getVoltageV())
            .message(reading.getMessage())
            .activeEvents(events.stream().map(this::toDTO).collect(Collectors.toList()))
            .checkedAt(now)
            .build();
    }

    /**
     * Most recent critical event in effect for the operator, or null
     */
    public GridEvent findCriticalEvent(String discomId, LocalDateTime now) {
        if (discomId == null) {
            return null;
        }
        return activeEvents(discomId, now).stream()
            .filter(e -> e.getSeverity() == GridSeverity.CRITICAL)
            .findFirst()
            .orElse(null);
    }

    /** Stored events in effect plus events reported by the live source */
    private List<GridEvent> activeEvents(String discomId, LocalDateTime now) {
        int expired = gridEventRepository.expireEnded(discomId, now);
        if (expired > 0) {
            log.info("Expired {} ended grid event(s) for {}", expired, discomId);
        }
        List<GridEvent> events = new ArrayList<>(gridEventRepository.findInEffect(discomId, now));
        for (GridEvent live : gridDataSource.getActiveEvents(discomId)) {
            if (live.isInEffect(now)) {
                events.add(live);
            }
        }
        return events;
    }

    private GridEventDTO toDTO(GridEvent entity) {
        List<String> areas = Collections.emptyList();
        try {
            if (entity.getAffectedAreas() != null) {
                areas = objectMapper.readValue(entity.getAffectedAreas(), new TypeReference<List<String>>() {});
            }
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize affected areas for grid event {}: {}", entity.getId(), e.getMessage());
        }
        return GridEventDTO.builder()
            .id(entity.getId())
            .discomId(entity.getDiscomId())
            .eventType(entity.getEventType())
            .severity(entity.getSeverity())
            .message(entity.getMessage())
            .startTime(entity.getStartTime())
            .endTime(entity.getEndTime())
            .affectedAreas(areas)
            .active(entity.isActive())
            .build();
    }
}
