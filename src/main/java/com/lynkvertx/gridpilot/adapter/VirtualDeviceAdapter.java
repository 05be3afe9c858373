package com.lynkvertx.gridpilot.adapter;

import com.lynkvertx.gridpilot.entity.Appliance;
import com.lynkvertx.gridpilot.entity.ApplianceStatus;
import com.lynkvertx.gridpilot.repository.ApplianceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Simulated devices: the appliance row is the device state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VirtualDeviceAdapter implements DeviceAdapter {

    private final ApplianceRepository applianceRepository;

    @Override
    public ActuationResult setPower(Long applianceId, ActuationCommand command) {
        Optional<Appliance> found = applianceRepository.findById(applianceId);
        if (!found.isPresent()) {
            return ActuationResult.failure("Appliance not found: " + applianceId);
        }
        Appliance appliance = found.get();
        if (!appliance.isControllable()) {
            return ActuationResult.failure("Appliance " + applianceId + " is not controllable");
        }
        switch (command) {
            case TURN_ON:
                applianceRepository.updateStatus(applianceId, ApplianceStatus.ON);
                break;
            case TURN_OFF:
                applianceRepository.updateStatus(applianceId, ApplianceStatus.OFF);
                break;
            case ECO_ON:
                applianceRepository.updateEcoMode(applianceId, true);
                break;
            case ECO_OFF:
                applianceRepository.updateEcoMode(applianceId, false);
                break;
            default:
                return ActuationResult.failure("Unsupported command " + command);
        }
        log.debug("Virtual device {} <- {}", applianceId, command);
        return ActuationResult.ok(command + " applied");
    }
}
