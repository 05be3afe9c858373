package com.lynkvertx.gridpilot.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.lynkvertx.gridpilot.calculation.HourlyCarbonTable;
import com.lynkvertx.gridpilot.calculation.HourlyTariffTable;
import com.lynkvertx.gridpilot.calculation.PenaltyScorer;
import com.lynkvertx.gridpilot.config.AutopilotProperties;
import com.lynkvertx.gridpilot.dto.PenaltyTimelineDTO;
import com.lynkvertx.gridpilot.entity.Home;
import com.lynkvertx.gridpilot.repository.HomeRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.persistence.EntityNotFoundException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Per-home penalty timeline.
 * The last successful computation per home is kept; if a recomputation fails it is served with stale=true.
 */
@Slf4j
@Service
public class PenaltyTimelineService {

    private final HomeRepository homeRepository;
    private final ReferenceTableService referenceTables;
    private final PenaltyScorer scorer;
    private final AutopilotProperties properties;
    private final Clock clock;
    private final Cache<Long, PenaltyTimelineDTO> lastKnownGood;

    public PenaltyTimelineService(HomeRepository homeRepository,
                                  ReferenceTableService referenceTables,
                                  PenaltyScorer scorer,
                                  AutopilotProperties properties,
                                  Clock clock) {
        this.homeRepository = homeRepository;
        this.referenceTables = referenceTables;
        this.scorer = scorer;
        this.properties = properties;
        this.clock = clock;
        this.lastKnownGood = Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofDays(1))
            .maximumSize(10_000)
            .build();
    }

    public PenaltyTimelineDTO getPenaltyTimeline(Long homeId) {
        Home home = homeRepository.findById(homeId)
            .orElseThrow(() -> new EntityNotFoundException("Home not found with id: " + homeId));
        LocalDateTime now = LocalDateTime.now(clock);
        try {
            HourlyTariffTable tariff = referenceTables.tariffTable(home.getTariffPlanId());
            HourlyCarbonTable carbon = referenceTables.carbonTable(home.getRegionCode());
            PenaltyTimelineDTO timeline = PenaltyTimelineDTO.builder()
                .homeId(homeId)
                .strategy(home.getStrategy())
                .penaltyThreshold(properties.getPenaltyThreshold())
                .currentHour(now.getHour())
                .hours(scorer.timeline(tariff, carbon, home.getStrategy(), properties.getPenaltyThreshold(),
                    properties.getCostScale(), properties.getCarbonScale()))
                .computedAt(now)
                .stale(false)
                .build();
            lastKnownGood.put(homeId, timeline);
            return timeline;
        } catch (RuntimeException e) {
            PenaltyTimelineDTO previous = lastKnownGood.getIfPresent(homeId);
            if (previous == null) {
                throw e;
            }
            log.warn("Penalty timeline recomputation failed for home {}, serving result from {}: {}",
                homeId, previous.getComputedAt(), e.getMessage());
            return previous.toBuilder().stale(true).currentHour(now.getHour()).build();
        }
    }

    /** Penalty of the given hour under the home's strategy */
    public double currentPenalty(Home home, int hour) {
        return scorer.penalty(hour,
            referenceTables.tariffTable(home.getTariffPlanId()),
            referenceTables.carbonTable(home.getRegionCode()),
            home.getStrategy());
    }

    /**
     * Start of the first later hour whose penalty is at or below the threshold,
     * or now plus the fallback horizon if no such hour exists.
     */
    public LocalDateTime nextAcceptableHour(Home home, LocalDateTime now) {
        HourlyTariffTable tariff = referenceTables.tariffTable(home.getTariffPlanId());
        HourlyCarbonTable carbon = referenceTables.carbonTable(home.getRegionCode());
        LocalDateTime hourStart = now.withMinute(0).withSecond(0).withNano(0);
        for (int offset = 1; offset <= 24; offset++) {
            LocalDateTime candidate = hourStart.plusHours(offset);
            if (scorer.penalty(candidate.getHour(), tariff, carbon, home.getStrategy()) <= properties.getPenaltyThreshold()) {
                return candidate;
            }
        }
        return now.plusHours(properties.getOverrideFallbackHours());
    }

    public double threshold() {
        return properties.getPenaltyThreshold();
    }

    public String label(double penalty) {
        return scorer.label(penalty, properties.getPenaltyThreshold());
    }
}
