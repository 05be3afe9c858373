package com.lynkvertx.gridpilot.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.lynkvertx.gridpilot.calculation.HourlyCarbonTable;
import com.lynkvertx.gridpilot.config.AutopilotProperties;
import com.lynkvertx.gridpilot.dto.CarbonNowDTO;
import com.lynkvertx.gridpilot.entity.Home;
import com.lynkvertx.gridpilot.repository.HomeRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.persistence.EntityNotFoundException;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Current carbon intensity of a home's grid region, with the same last-known-good fallback as the timeline.
 */
@Slf4j
@Service
public class CarbonStatusService {

    private static final int CLEANEST_HOURS = 4;

    private final HomeRepository homeRepository;
    private final ReferenceTableService referenceTables;
    private final AutopilotProperties properties;
    private final Clock clock;
    private final Cache<Long, CarbonNowDTO> lastKnownGood = Caffeine.newBuilder()
        .expireAfterWrite(Duration.ofDays(1))
        .maximumSize(10_000)
        .build();

    public CarbonStatusService(HomeRepository homeRepository, ReferenceTableService referenceTables,
                               AutopilotProperties properties, Clock clock) {
        this.homeRepository = homeRepository;
        this.referenceTables = referenceTables;
        this.properties = properties;
        this.clock = clock;
    }

    public CarbonNowDTO getCarbonNow(Long homeId) {
        Home home = homeRepository.findById(homeId)
            .orElseThrow(() -> new EntityNotFoundException("Home not found with id: " + homeId));
        LocalDateTime now = LocalDateTime.now(clock);
        int hour = now.getHour();
        try {
            HourlyCarbonTable carbon = referenceTables.carbonTable(home.getRegionCode());
            CarbonNowDTO status = CarbonNowDTO.builder()
                .homeId(homeId)
                .regionCode(home.getRegionCode())
                .hour(hour)
                .intensity(carbon.intensityAt(hour).setScale(properties.getCarbonScale(), RoundingMode.HALF_UP))
                .cleanWindow(carbon.isCleanWindow(hour))
                .dailyMean(carbon.mean().setScale(2, RoundingMode.HALF_UP))
                .cleanestHours(carbon.cleanestHours(CLEANEST_HOURS))
                .computedAt(now)
                .build();
            lastKnownGood.put(homeId, status);
            return status;
        } catch (RuntimeException e) {
            CarbonNowDTO previous = lastKnownGood.getIfPresent(homeId);
            if (previous == null) {
                throw e;
            }
            log.warn("Carbon status recomputation failed for home {}, serving result from {}: {}",
                homeId, previous.getComputedAt(), e.getMessage());
            return previous.toBuilder().stale(true).build();
        }
    }
}
