package com.lynkvertx.gridpilot.service;

import com.lynkvertx.gridpilot.calculation.HourlyCarbonTable;
import com.lynkvertx.gridpilot.calculation.HourlyTariffTable;
import com.lynkvertx.gridpilot.calculation.RunRequest;
import com.lynkvertx.gridpilot.calculation.RunWindowOptimizer;
import com.lynkvertx.gridpilot.calculation.ScheduleWindow;
import com.lynkvertx.gridpilot.calculation.WindowOptions;
import com.lynkvertx.gridpilot.config.AutopilotProperties;
import com.lynkvertx.gridpilot.entity.Appliance;
import com.lynkvertx.gridpilot.entity.Home;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Start-time suggestions for running an appliance, priced with its home's tariff plan and carbon region
 */
@Service
@RequiredArgsConstructor
public class ScheduleOptionService {

    private final ApplianceService applianceService;
    private final HomeService homeService;
    private final ReferenceTableService referenceTables;
    private final RunWindowOptimizer optimizer;
    private final AutopilotProperties properties;
    private final Clock clock;

    public ScheduleWindow getBestWindow(Long applianceId, double durationHours) {
        Appliance appliance = applianceService.findAppliance(applianceId);
        Home home = homeService.findHome(appliance.getHomeId());
        return optimizer.bestWindow(request(appliance, home, durationHours, null),
            referenceTables.tariffTable(home.getTariffPlanId()),
            referenceTables.carbonTable(home.getRegionCode()));
    }

    public WindowOptions getScheduleOptions(Long applianceId, double durationHours, Integer customStartHour) {
        Appliance appliance = applianceService.findAppliance(applianceId);
        Home home = homeService.findHome(appliance.getHomeId());
        HourlyTariffTable tariff = referenceTables.tariffTable(home.getTariffPlanId());
        HourlyCarbonTable carbon = referenceTables.carbonTable(home.getRegionCode());
        return optimizer.options(request(appliance, home, durationHours, customStartHour), tariff, carbon);
    }

    private RunRequest request(Appliance appliance, Home home, double durationHours, Integer customStartHour) {
        if (!(durationHours > 0) || durationHours > 24) {
            throw new IllegalArgumentException("durationHours must be greater than 0 and at most 24");
        }
        return RunRequest.builder()
            .powerW(appliance.getRatedPowerW())
            .durationHours(durationHours)
            .fromHour(LocalDateTime.now(clock).getHour())
            .strategy(home.getStrategy())
            .customStartHour(customStartHour)
            .costScale(properties.getCostScale())
            .carbonScale(properties.getCarbonScale())
            .build();
    }
}
