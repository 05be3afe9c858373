package com.lynkvertx.gridpilot.service;

import com.lynkvertx.gridpilot.adapter.ActuationResult;
import com.lynkvertx.gridpilot.dto.ControlLogDTO;
import com.lynkvertx.gridpilot.entity.ControlLog;
import com.lynkvertx.gridpilot.repository.ControlLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Append-only audit trail of device actions. Every call appends; nothing is coalesced.
 */
@Service
@RequiredArgsConstructor
public class AuditService {

    public static final String SOURCE_STRATEGY = "autopilot_strategy";
    public static final String SOURCE_GRID = "grid_protection";
    public static final String SOURCE_STRATEGY_RESTORE = "autopilot_restore";
    public static final String SOURCE_GRID_RESTORE = "grid_restore";
    public static final String SOURCE_SCHEDULER = "scheduler";

    private final ControlLogRepository controlLogRepository;
    private final Clock clock;

    public ControlLog record(Long applianceId, String action, String triggerSource, ActuationResult result) {
        ControlLog entry = ControlLog.builder()
            .applianceId(applianceId)
            .action(action)
            .triggerSource(triggerSource)
            .result(result.isSuccess() ? ControlLog.RESULT_SUCCESS : ControlLog.RESULT_FAILURE)
            .message(truncate(result.getMessage()))
            .responseTimeMs(result.getResponseTimeMs())
            .loggedAt(LocalDateTime.now(clock))
            .build();
        return controlLogRepository.save(entry);
    }

    public List<ControlLogDTO> getLogs(Long applianceId) {
        return controlLogRepository.findTop100ByApplianceIdOrderByLoggedAtDescIdDesc(applianceId)
            .stream()
            .map(this::toDTO)
            .collect(Collectors.toList());
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 500) {
            return message;
        }
        return message.substring(0, 500);
    }

    private ControlLogDTO toDTO(ControlLog entity) {
        return ControlLogDTO.builder()
            .id(entity.getId())
            .applianceId(entity.getApplianceId())
            .action(entity.getAction())
            .triggerSource(entity.getTriggerSource())
            .result(entity.getResult())
            .message(entity.getMessage())
            .responseTimeMs(entity.getResponseTimeMs())
            .loggedAt(entity.getLoggedAt())
            .build();
    }
}
