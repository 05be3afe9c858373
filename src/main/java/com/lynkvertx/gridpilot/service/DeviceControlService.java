package com.lynkvertx.gridpilot.service;

import com.lynkvertx.gridpilot.adapter.ActuationCommand;
import com.lynkvertx.gridpilot.adapter.ActuationResult;
import com.lynkvertx.gridpilot.adapter.DeviceActuator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Sends a command to a device and audits it. Each call is one actuation and one audit entry,
 * including re-sends to a device already in the target state. Failures are returned, never thrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeviceControlService {

    private final DeviceActuator actuator;
    private final AuditService auditService;

    public ActuationResult execute(Long applianceId, ActuationCommand command, String auditAction, String triggerSource) {
        ActuationResult result = actuator.actuate(applianceId, command);
        auditService.record(applianceId, auditAction, triggerSource, result);
        if (result.isSuccess()) {
            log.info("{} on appliance {} ({}) in {} ms", auditAction, applianceId, triggerSource, result.getResponseTimeMs());
        } else {
            log.warn("{} on appliance {} ({}) failed: {}; will retry on next tick",
                auditAction, applianceId, triggerSource, result.getMessage());
        }
        return result;
    }
}
