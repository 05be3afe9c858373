package com.lynkvertx.gridpilot.service;

import com.lynkvertx.gridpilot.dto.AutopilotStatusDTO;
import com.lynkvertx.gridpilot.dto.HomeDTO;
import com.lynkvertx.gridpilot.entity.AutopilotStrategy;
import com.lynkvertx.gridpilot.entity.DeviceAutopilotConfig;
import com.lynkvertx.gridpilot.entity.Home;
import com.lynkvertx.gridpilot.repository.DeviceAutopilotConfigRepository;
import com.lynkvertx.gridpilot.repository.HomeRepository;
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
 * Home registration and the home-level autopilot settings (strategy, grid protection, on/off)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HomeService {

    private final HomeRepository homeRepository;
    private final DeviceAutopilotConfigRepository configRepository;
    private final PenaltyTimelineService timelineService;
    private final Clock clock;

    public List<HomeDTO> getAllHomes() {
        return homeRepository.findAllByOrderByCreatedAtDesc()
            .stream()
            .map(this::toDTO)
            .collect(Collectors.toList());
    }

    public HomeDTO getHomeById(Long id) {
        return toDTO(findHome(id));
    }

    public Home findHome(Long id) {
        return homeRepository.findById(id)
            .orElseThrow(() -> new EntityNotFoundException("Home not found with id: " + id));
    }

    @Transactional
    public HomeDTO createHome(HomeDTO dto) {
        Home home = Home.builder()
            .name(dto.getName())
            .tariffPlanId(dto.getTariffPlanId())
            .regionCode(dto.getRegionCode())
            .discomId(dto.getDiscomId())
            .autopilotEnabled(Boolean.TRUE.equals(dto.getAutopilotEnabled()))
            .strategy(dto.getStrategy() != null ? dto.getStrategy() : AutopilotStrategy.BALANCED)
            .gridProtectionEnabled(Boolean.TRUE.equals(dto.getGridProtectionEnabled()))
            .build();
        Home saved = homeRepository.save(home);
        log.info("Created home {} (plan={}, region={}, discom={})",
            saved.getId(), saved.getTariffPlanId(), saved.getRegionCode(), saved.getDiscomId());
        return toDTO(saved);
    }

    public AutopilotStatusDTO getAutopilotStatus(Long homeId) {
        Home home = findHome(homeId);
        LocalDateTime now = LocalDateTime.now(clock);
        List<DeviceAutopilotConfig> delegated = configRepository.findByHomeIdAndDelegatedTrue(homeId);
        double penalty = timelineService.currentPenalty(home, now.getHour());
        return AutopilotStatusDTO.builder()
            .homeId(homeId)
            .enabled(home.isAutopilotEnabled())
            .strategy(home.getStrategy())
            .gridProtectionEnabled(home.isGridProtectionEnabled())
            .currentPenalty(penalty)
            .penaltyThreshold(timelineService.threshold())
            .currentLabel(timelineService.label(penalty))
            .delegatedDevices(delegated.size())
            .activeOverrides((int) delegated.stream().filter(c -> c.isOverrideInEffect(now)).count())
            .build();
    }

    /**
     * @throws IllegalArgumentException for a value outside balanced / maxSavings / eco
     */
    @Transactional
    public AutopilotStatusDTO updateStrategy(Long homeId, String strategy) {
        AutopilotStrategy parsed = AutopilotStrategy.fromValue(strategy);
        Home home = findHome(homeId);
        home.setStrategy(parsed);
        homeRepository.save(home);
        log.info("Home {} strategy set to {}", homeId, parsed.getValue());
        return getAutopilotStatus(homeId);
    }

    @Transactional
    public AutopilotStatusDTO updateGridProtection(Long homeId, boolean enabled) {
        Home home = findHome(homeId);
        home.setGridProtectionEnabled(enabled);
        homeRepository.save(home);
        log.info("Home {} grid protection {}", homeId, enabled ? "enabled" : "disabled");
        return getAutopilotStatus(homeId);
    }

    @Transactional
    public AutopilotStatusDTO updateAutopilotEnabled(Long homeId, boolean enabled) {
        Home home = findHome(homeId);
        home.setAutopilotEnabled(enabled);
        homeRepository.save(home);
        log.info("Home {} autopilot {}", homeId, enabled ? "enabled" : "disabled");
        return getAutopilotStatus(homeId);
    }

    private HomeDTO toDTO(Home entity) {
        return HomeDTO.builder()
            .id(entity.getId())
            .name(entity.getName())
            .tariffPlanId(entity.getTariffPlanId())
            .regionCode(entity.getRegionCode())
            .discomId(entity.getDiscomId())
            .autopilotEnabled(entity.isAutopilotEnabled())
            .strategy(entity.getStrategy())
            .gridProtectionEnabled(entity.isGridProtectionEnabled())
            .createdAt(entity.getCreatedAt())
            .updatedAt(entity.getUpdatedAt())
            .build();
    }
}
