package com.lynkvertx.gridpilot.service;

import com.lynkvertx.gridpilot.adapter.ActuationCommand;
import com.lynkvertx.gridpilot.adapter.ActuationResult;
import com.lynkvertx.gridpilot.config.AutopilotProperties;
import com.lynkvertx.gridpilot.dto.DeviceDecisionDTO;
import com.lynkvertx.gridpilot.dto.TickReportDTO;
import com.lynkvertx.gridpilot.entity.Appliance;
import com.lynkvertx.gridpilot.entity.BaselineTrigger;
import com.lynkvertx.gridpilot.entity.DeviceAutopilotConfig;
import com.lynkvertx.gridpilot.entity.GridEvent;
import com.lynkvertx.gridpilot.entity.Home;
import com.lynkvertx.gridpilot.entity.PreferredAction;
import com.lynkvertx.gridpilot.exception.ConcurrentOverrideConflictException;
import com.lynkvertx.gridpilot.policy.AutopilotDecision;
import com.lynkvertx.gridpilot.policy.AutopilotPolicyEngine;
import com.lynkvertx.gridpilot.policy.DecisionAction;
import com.lynkvertx.gridpilot.policy.GuardContext;
import com.lynkvertx.gridpilot.repository.ApplianceRepository;
import com.lynkvertx.gridpilot.repository.DeviceAutopilotConfigRepository;
import com.lynkvertx.gridpilot.repository.HomeRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import javax.persistence.EntityNotFoundException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * One evaluation tick of the autopilot.
 *
 * For each autopilot-enabled home: compute the home-level signals once (current penalty, critical
 * grid event), run the guard chain for every delegated device concurrently, apply acting decisions,
 * then restore baselines whose trigger has ended. A decision is applied only after a version-conditioned
 * claim on the device config succeeds; a lost claim re-reads the config and decides again.
 */
@Slf4j
@Service
public class AutopilotTickService {

    private final HomeRepository homeRepository;
    private final ApplianceRepository applianceRepository;
    private final DeviceAutopilotConfigRepository configRepository;
    private final PenaltyTimelineService timelineService;
    private final GridProtectionService gridProtectionService;
    private final AutopilotPolicyEngine policyEngine;
    private final BaselineService baselineService;
    private final OverrideService overrideService;
    private final DeviceControlService deviceControl;
    private final AutopilotProperties properties;
    private final Clock clock;
    private final TaskExecutor evaluationExecutor;

    public AutopilotTickService(HomeRepository homeRepository,
                                ApplianceRepository applianceRepository,
                                DeviceAutopilotConfigRepository configRepository,
                                PenaltyTimelineService timelineService,
                                GridProtectionService gridProtectionService,
                                AutopilotPolicyEngine policyEngine,
                                BaselineService baselineService,
                                OverrideService overrideService,
                                DeviceControlService deviceControl,
                                AutopilotProperties properties,
                                Clock clock,
                                @Qualifier("evaluationExecutor") TaskExecutor evaluationExecutor) {
        this.homeRepository = homeRepository;
        this.applianceRepository = applianceRepository;
        this.configRepository = configRepository;
        this.timelineService = timelineService;
        this.gridProtectionService = gridProtectionService;
        this.policyEngine = policyEngine;
        this.baselineService = baselineService;
        this.overrideService = overrideService;
        this.deviceControl = deviceControl;
        this.properties = properties;
        this.clock = clock;
        this.evaluationExecutor = evaluationExecutor;
    }

    /**
     * Evaluate every autopilot-enabled home. A failing home is logged and skipped.
     */
    public List<TickReportDTO> runTick() {
        List<TickReportDTO> reports = new ArrayList<>();
        for (Home home : homeRepository.findByAutopilotEnabledTrue()) {
            try {
                reports.add(evaluate(home, false));
            } catch (RuntimeException e) {
                log.error("Autopilot tick failed for home {}", home.getId(), e);
            }
        }
        int acted = reports.stream().mapToInt(r -> (int) r.getDecisions().stream().filter(DeviceDecisionDTO::isApplied).count()).sum();
        log.info("Autopilot tick: {} home(s), {} device action(s)", reports.size(), acted);
        return reports;
    }

    public TickReportDTO evaluateHome(Long homeId) {
        return evaluate(findHome(homeId), false);
    }

    /** Decisions only: no claims, no commands, no baseline or override writes */
    public TickReportDTO preview(Long homeId) {
        return evaluate(findHome(homeId), true);
    }

    TickReportDTO evaluate(Home home, boolean dryRun) {
        LocalDateTime now = LocalDateTime.now(clock);
        double penalty = timelineService.currentPenalty(home, now.getHour());
        GridEvent critical = home.isGridProtectionEnabled()
            ? gridProtectionService.findCriticalEvent(home.getDiscomId(), now)
            : null;

        List<CompletableFuture<DeviceDecisionDTO>> futures = configRepository.findByHomeIdAndDelegatedTrue(home.getId())
            .stream()
            .map(config -> CompletableFuture.supplyAsync(
                () -> evaluateDevice(home, config.getApplianceId(), now, penalty, critical, dryRun), evaluationExecutor))
            .collect(Collectors.toList());
        List<DeviceDecisionDTO> decisions = futures.stream()
            .map(CompletableFuture::join)
            .collect(Collectors.toList());

        int restored = 0;
        if (!dryRun) {
            if (penalty <= properties.getPenaltyThreshold()
                && baselineService.hasPending(home.getId(), BaselineTrigger.STRATEGY)) {
                restored += baselineService.restore(home.getId(), BaselineTrigger.STRATEGY);
                overrideService.clearForHome(home.getId());
            }
            if (critical == null && baselineService.hasPending(home.getId(), BaselineTrigger.GRID_EVENT)) {
                restored += baselineService.restore(home.getId(), BaselineTrigger.GRID_EVENT);
            }
        }

        return TickReportDTO.builder()
            .homeId(home.getId())
            .evaluatedAt(now)
            .strategy(home.getStrategy())
            .penalty(penalty)
            .dryRun(dryRun)
            .decisions(decisions)
            .restored(restored)
            .conflicts(decisions.stream().mapToInt(DeviceDecisionDTO::getConflicts).sum())
            .failures((int) decisions.stream().filter(d -> !d.isSuccess()).count())
            .build();
    }

    /**
     * Decide and act for one device, re-reading and re-deciding after each lost claim.
     * Never throws: failures are reported in the returned decision.
     */
    DeviceDecisionDTO evaluateDevice(Home home, Long applianceId, LocalDateTime now, double penalty,
                                     GridEvent critical, boolean dryRun) {
        int conflicts = 0;
        while (true) {
            try {
                DeviceDecisionDTO decision = evaluateOnce(home, applianceId, now, penalty, critical, dryRun);
                decision.setConflicts(conflicts);
                return decision;
            } catch (ConcurrentOverrideConflictException e) {
                conflicts++;
                if (conflicts > properties.getConflictRetryLimit()) {
                    log.warn("Appliance {}: gave up after {} lost claims this tick", applianceId, conflicts);
                    return DeviceDecisionDTO.builder()
                        .applianceId(applianceId)
                        .action(DecisionAction.NOOP)
                        .success(false)
                        .message("Config kept changing; retry next tick")
                        .conflicts(conflicts)
                        .build();
                }
                log.warn("{}; re-reading and re-evaluating", e.getMessage());
            } catch (RuntimeException e) {
                log.error("Autopilot evaluation failed for appliance {}", applianceId, e);
                return DeviceDecisionDTO.builder()
                    .applianceId(applianceId)
                    .action(DecisionAction.NOOP)
                    .success(false)
                    .message(e.getMessage())
                    .conflicts(conflicts)
                    .build();
            }
        }
    }

    private DeviceDecisionDTO evaluateOnce(Home home, Long applianceId, LocalDateTime now, double penalty,
                                          GridEvent critical, boolean dryRun) {
        if (!dryRun) {
            overrideService.clearIfExpired(applianceId, now);
        }
        Optional<DeviceAutopilotConfig> foundConfig = configRepository.findByApplianceId(applianceId);
        Optional<Appliance> foundAppliance = applianceRepository.findById(applianceId);
        if (!foundConfig.isPresent() || !foundConfig.get().isDelegated()
            || !foundAppliance.isPresent() || !foundAppliance.get().isControllable()) {
            return DeviceDecisionDTO.builder()
                .applianceId(applianceId)
                .action(DecisionAction.NOOP)
                .reason("Not delegated or not controllable")
                .success(true)
                .build();
        }
        DeviceAutopilotConfig config = foundConfig.get();
        Appliance appliance = foundAppliance.get();

        AutopilotDecision decision = policyEngine.decide(GuardContext.builder()
            .home(home)
            .appliance(appliance)
            .config(config)
            .now(now)
            .currentPenalty(penalty)
            .penaltyThreshold(properties.getPenaltyThreshold())
            .criticalEvent(critical)
            .ecoCapable(properties.getEcoCapableCategories().contains(appliance.getCategory()))
            .build());

        DeviceDecisionDTO.DeviceDecisionDTOBuilder result = DeviceDecisionDTO.builder()
            .applianceId(applianceId)
            .applianceName(appliance.getName())
            .action(decision.getAction())
            .preferredAction(decision.getPreferredAction())
            .guard(decision.getGuard())
            .reason(decision.getReason())
            .success(true);

        Command command = decision.isActing() ? commandFor(decision, appliance) : null;
        if (dryRun || command == null) {
            return result.applied(false).build();
        }

        if (configRepository.claimIfUnchanged(config.getId(), config.getVersion(), now) == 0) {
            throw new ConcurrentOverrideConflictException(applianceId, config.getVersion());
        }

        BaselineTrigger trigger = decision.getAction() == DecisionAction.FORCE_OFF
            ? BaselineTrigger.GRID_EVENT
            : BaselineTrigger.STRATEGY;
        baselineService.saveIfAbsent(appliance, trigger);

        String source = trigger == BaselineTrigger.GRID_EVENT ? AuditService.SOURCE_GRID : AuditService.SOURCE_STRATEGY;
        ActuationResult actuation = deviceControl.execute(applianceId, command.command, command.auditAction, source);
        return result.applied(true)
            .success(actuation.isSuccess())
            .message(actuation.getMessage())
            .build();
    }

    /**
     * Device command for an acting decision, or null when the device is already in the target state
     */
    static Command commandFor(AutopilotDecision decision, Appliance appliance) {
        if (!appliance.getStatus().isRunning()) {
            return null;
        }
        if (decision.getAction() == DecisionAction.FORCE_OFF) {
            return new Command(ActuationCommand.TURN_OFF, "force_off");
        }
        PreferredAction action = decision.getPreferredAction();
        switch (action) {
            case TURN_OFF:
                return new Command(ActuationCommand.TURN_OFF, "turn_off");
            case DELAY_START:
                return new Command(ActuationCommand.TURN_OFF, "delay_start_off");
            case ECO_MODE:
                return appliance.isEcoModeEnabled() ? null : new Command(ActuationCommand.ECO_ON, "eco_mode_on");
            case LIMIT_POWER:
                return appliance.isEcoModeEnabled() ? null : new Command(ActuationCommand.ECO_ON, "limit_power");
            default:
                return null;
        }
    }

    private Home findHome(Long homeId) {
        return homeRepository.findById(homeId)
            .orElseThrow(() -> new EntityNotFoundException("Home not found with id: " + homeId));
    }

    static class Command {
        final ActuationCommand command;
        final String auditAction;

        Command(ActuationCommand command, String auditAction) {
            this.command = command;
            this.auditAction = auditAction;
        }
    }
}
