package com.lynkvertx.gridpilot.service;

import com.lynkvertx.gridpilot.entity.DeviceAutopilotConfig;
import com.lynkvertx.gridpilot.entity.Home;
import com.lynkvertx.gridpilot.repository.DeviceAutopilotConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * User/physical override flags on delegated devices.
 * All writes are conditional updates; see {@link DeviceAutopilotConfigRepository}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OverrideService {

    private final DeviceAutopilotConfigRepository configRepository;
    private final PenaltyTimelineService timelineService;

    /**
     * A human switched the device while autopilot manages it: suppress autopilot on it until the
     * penalty window in effect ends.
     *
     * @return the override expiry, or empty if the device is not under autopilot
     */
    public Optional<LocalDateTime> raiseOnHumanToggle(Home home, Long applianceId, LocalDateTime now) {
        if (!home.isAutopilotEnabled()) {
            return Optional.empty();
        }
        Optional<DeviceAutopilotConfig> config = configRepository.findByApplianceId(applianceId);
        if (!config.isPresent() || !config.get().isDelegated()) {
            return Optional.empty();
        }
        LocalDateTime until = timelineService.nextAcceptableHour(home, now);
        if (configRepository.raiseOverride(applianceId, until) == 0) {
            return Optional.empty();
        }
        log.info("Override raised on appliance {} until {}", applianceId, until);
        return Optional.of(until);
    }

    /**
     * @return true if an elapsed override was cleared
     */
    public boolean clearIfExpired(Long applianceId, LocalDateTime now) {
        boolean cleared = configRepository.clearExpiredOverride(applianceId, now) > 0;
        if (cleared) {
            log.info("Override on appliance {} expired", applianceId);
        }
        return cleared;
    }

    public int clearForHome(Long homeId) {
        int cleared = configRepository.clearOverridesForHome(homeId);
        if (cleared > 0) {
            log.info("Cleared {} override(s) for home {} on strategy restore", cleared, homeId);
        }
        return cleared;
    }
}
