package com.lynkvertx.gridpilot.service;

import com.lynkvertx.gridpilot.adapter.ActuationCommand;
import com.lynkvertx.gridpilot.adapter.ActuationResult;
import com.lynkvertx.gridpilot.dto.ApplianceDTO;
import com.lynkvertx.gridpilot.dto.ToggleRequestDTO;
import com.lynkvertx.gridpilot.entity.Appliance;
import com.lynkvertx.gridpilot.entity.ApplianceStatus;
import com.lynkvertx.gridpilot.entity.Home;
import com.lynkvertx.gridpilot.exception.ActuationFailedException;
import com.lynkvertx.gridpilot.repository.ApplianceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import javax.persistence.EntityNotFoundException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Appliance registration and human control of appliances
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApplianceService {

    private final ApplianceRepository applianceRepository;
    private final HomeService homeService;
    private final DeviceControlService deviceControl;
    private final OverrideService overrideService;
    private final Clock clock;

    public List<ApplianceDTO> getByHomeId(Long homeId) {
        homeService.findHome(homeId);
        return applianceRepository.findByHomeId(homeId)
            .stream()
            .map(this::toDTO)
            .collect(Collectors.toList());
    }

    public Appliance findAppliance(Long id) {
        return applianceRepository.findById(id)
            .orElseThrow(() -> new EntityNotFoundException("Appliance not found with id: " + id));
    }

    @Transactional
    public ApplianceDTO createAppliance(Long homeId, ApplianceDTO dto) {
        homeService.findHome(homeId);
        Appliance saved = applianceRepository.save(Appliance.builder()
            .homeId(homeId)
            .name(dto.getName())
            .category(dto.getCategory())
            .ratedPowerW(dto.getRatedPowerW())
            .status(dto.getStatus() != null ? dto.getStatus() : ApplianceStatus.OFF)
            .ecoModeEnabled(Boolean.TRUE.equals(dto.getEcoModeEnabled()))
            .controllable(dto.getControllable() == null || dto.getControllable())
            .build());
        log.info("Registered appliance {} ({}, {} W) in home {}", saved.getId(), saved.getCategory(),
            saved.getRatedPowerW(), homeId);
        return toDTO(saved);
    }

    /**
     * Switch a device on behalf of a human. If autopilot manages the device, this raises an override.
     */
    public ApplianceDTO toggle(Long applianceId, ToggleRequestDTO request) {
        Appliance appliance = findAppliance(applianceId);
        Home home = homeService.findHome(appliance.getHomeId());
        boolean on = Boolean.TRUE.equals(request.getOn());
        String source = request.getSource() != null ? request.getSource() : "user";

        ActuationResult result = deviceControl.execute(applianceId,
            on ? ActuationCommand.TURN_ON : ActuationCommand.TURN_OFF,
            on ? "turn_on" : "turn_off",
            source);
        if (!result.isSuccess()) {
            throw new ActuationFailedException(applianceId, result.getMessage());
        }
        overrideService.raiseOnHumanToggle(home, applianceId, LocalDateTime.now(clock));
        return toDTO(findAppliance(applianceId));
    }

    private ApplianceDTO toDTO(Appliance entity) {
        return ApplianceDTO.builder()
            .id(entity.getId())
            .homeId(entity.getHomeId())
            .name(entity.getName())
            .category(entity.getCategory())
            .ratedPowerW(entity.getRatedPowerW())
            .status(entity.getStatus())
            .ecoModeEnabled(entity.isEcoModeEnabled())
            .controllable(entity.isControllable())
            .build();
    }
}
