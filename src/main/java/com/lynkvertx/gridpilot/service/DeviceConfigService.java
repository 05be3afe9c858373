package com.lynkvertx.gridpilot.service;

import com.lynkvertx.gridpilot.dto.DeviceAutopilotConfigDTO;
import com.lynkvertx.gridpilot.entity.Appliance;
import com.lynkvertx.gridpilot.entity.DeviceAutopilotConfig;
import com.lynkvertx.gridpilot.entity.PreferredAction;
import com.lynkvertx.gridpilot.repository.DeviceAutopilotConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per-device delegation settings. The config row is created the first time a device is delegated.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeviceConfigService {

    private final DeviceAutopilotConfigRepository configRepository;
    private final ApplianceService applianceService;

    public DeviceAutopilotConfigDTO getConfig(Long applianceId) {
        Appliance appliance = applianceService.findAppliance(applianceId);
        return configRepository.findByApplianceId(applianceId)
            .map(this::toDTO)
            .orElseGet(() -> DeviceAutopilotConfigDTO.builder()
                .applianceId(applianceId)
                .homeId(appliance.getHomeId())
                .preferredAction(PreferredAction.DELAY_START)
                .protectedWindowEnabled(false)
                .delegated(false)
                .build());
    }

    @Transactional
    public DeviceAutopilotConfigDTO updateConfig(Long applianceId, DeviceAutopilotConfigDTO dto) {
        Appliance appliance = applianceService.findAppliance(applianceId);
        DeviceAutopilotConfig config = configRepository.findByApplianceId(applianceId)
            .orElseGet(() -> DeviceAutopilotConfig.builder()
                .applianceId(applianceId)
                .homeId(appliance.getHomeId())
                .build());

        if (dto.getPreferredAction() != null) {
            config.setPreferredAction(dto.getPreferredAction());
        }
        if (dto.getDelegated() != null) {
            config.setDelegated(dto.getDelegated());
        }
        if (dto.getProtectedWindowEnabled() != null) {
            config.setProtectedWindowEnabled(dto.getProtectedWindowEnabled());
        }
        if (dto.getProtectedWindowStart() != null) {
            config.setProtectedWindowStart(dto.getProtectedWindowStart());
        }
        if (dto.getProtectedWindowEnd() != null) {
            config.setProtectedWindowEnd(dto.getProtectedWindowEnd());
        }
        if (config.isProtectedWindowEnabled()
            && (config.getProtectedWindowStart() == null || config.getProtectedWindowEnd() == null)) {
            throw new IllegalArgumentException("Protected window needs both a start and an end time");
        }
        if (config.isProtectedWindowEnabled() && config.getProtectedWindowStart().equals(config.getProtectedWindowEnd())) {
            throw new IllegalArgumentException("Protected window start and end must differ");
        }

        DeviceAutopilotConfig saved = configRepository.save(config);
        log.info("Autopilot config for appliance {}: delegated={}, action={}, protected={} {}-{}",
            applianceId, saved.isDelegated(), saved.getPreferredAction().getValue(), saved.isProtectedWindowEnabled(),
            saved.getProtectedWindowStart(), saved.getProtectedWindowEnd());
        return toDTO(saved);
    }

    private DeviceAutopilotConfigDTO toDTO(DeviceAutopilotConfig entity) {
        return DeviceAutopilotConfigDTO.builder()
            .applianceId(entity.getApplianceId())
            .homeId(entity.getHomeId())
            .preferredAction(entity.getPreferredAction())
            .protectedWindowEnabled(entity.isProtectedWindowEnabled())
            .protectedWindowStart(entity.getProtectedWindowStart())
            .protectedWindowEnd(entity.getProtectedWindowEnd())
            .delegated(entity.isDelegated())
            .overrideActive(entity.isOverrideActive())
            .overrideUntil(entity.getOverrideUntil())
            .lastEvaluatedAt(entity.getLastEvaluatedAt())
            .build();
    }
}
