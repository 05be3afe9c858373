package com.lynkvertx.gridpilot.service;

import com.lynkvertx.gridpilot.adapter.ActuationCommand;
import com.lynkvertx.gridpilot.adapter.ActuationResult;
import com.lynkvertx.gridpilot.entity.Appliance;
import com.lynkvertx.gridpilot.entity.AutopilotSavedState;
import com.lynkvertx.gridpilot.entity.BaselineTrigger;
import com.lynkvertx.gridpilot.repository.ApplianceRepository;
import com.lynkvertx.gridpilot.repository.AutopilotSavedStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Durable pre-action device state, one row per (appliance, trigger).
 *
 * The baseline is captured before autopilot first acts on a device and is never overwritten
 * while it is pending, so repeated actions keep the original state. Restore turns the device
 * back on and re-disables eco mode only where autopilot changed them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BaselineService {

    private final AutopilotSavedStateRepository savedStateRepository;
    private final ApplianceRepository applianceRepository;
    private final DeviceControlService deviceControl;
    private final Clock clock;

    /**
     * @return true if a new baseline was written
     */
    public boolean saveIfAbsent(Appliance appliance, BaselineTrigger trigger) {
        Optional<AutopilotSavedState> existing =
            savedStateRepository.findByApplianceIdAndTriggerType(appliance.getId(), trigger);
        if (existing.isPresent() && existing.get().isPending()) {
            return false;
        }
        AutopilotSavedState state = existing.orElseGet(() -> AutopilotSavedState.builder()
            .homeId(appliance.getHomeId())
            .applianceId(appliance.getId())
            .triggerType(trigger)
            .build());
        state.setPrevStatus(appliance.getStatus());
        state.setPrevEcoMode(appliance.isEcoModeEnabled());
        state.setSavedAt(LocalDateTime.now(clock));
        state.setRestoredAt(null);
        try {
            savedStateRepository.saveAndFlush(state);
        } catch (DataIntegrityViolationException e) {
            log.debug("Baseline for appliance {} ({}) written concurrently", appliance.getId(), trigger);
            return false;
        }
        log.info("Saved {} baseline for appliance {}: status={}, eco={}",
            trigger, appliance.getId(), state.getPrevStatus(), state.isPrevEcoMode());
        return true;
    }

    public boolean hasPending(Long homeId, BaselineTrigger trigger) {
        return savedStateRepository.existsByHomeIdAndTriggerTypeAndRestoredAtIsNull(homeId, trigger);
    }

    /**
     * Restore every pending baseline of a home for one trigger.
     * A baseline whose commands fail stays pending and is retried on the next tick.
     *
     * @return number of baselines marked restored
     */
    public int restore(Long homeId, BaselineTrigger trigger) {
        String source = trigger == BaselineTrigger.GRID_EVENT
            ? AuditService.SOURCE_GRID_RESTORE
            : AuditService.SOURCE_STRATEGY_RESTORE;
        List<AutopilotSavedState> pending =
            savedStateRepository.findByHomeIdAndTriggerTypeAndRestoredAtIsNull(homeId, trigger);
        int restored = 0;
        for (AutopilotSavedState state : pending) {
            if (restoreOne(state, source)) {
                int marked = savedStateRepository.markRestored(state.getId(), LocalDateTime.now(clock));
                restored += marked;
            }
        }
        if (restored > 0) {
            log.info("Restored {} {} baseline(s) for home {}", restored, trigger, homeId);
        }
        return restored;
    }

    private boolean restoreOne(AutopilotSavedState state, String source) {
        Optional<Appliance> found = applianceRepository.findById(state.getApplianceId());
        if (!found.isPresent()) {
            return true;
        }
        Appliance appliance = found.get();
        boolean ok = true;

        if (!state.isPrevEcoMode() && appliance.isEcoModeEnabled()) {
            ActuationResult result = deviceControl.execute(appliance.getId(), ActuationCommand.ECO_OFF, "eco_mode_off", source);
            ok = result.isSuccess();
        }
        // Already on means the user took it back; leave it
        if (state.getPrevStatus().isRunning() && !appliance.getStatus().isRunning()) {
            ActuationResult result = deviceControl.execute(appliance.getId(), ActuationCommand.TURN_ON, "turn_on", source);
            ok = ok && result.isSuccess();
        }
        return ok;
    }
}
