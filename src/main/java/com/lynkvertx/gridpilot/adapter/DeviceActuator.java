package com.lynkvertx.gridpilot.adapter;

import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Runs adapter calls on the actuation pool under a bounded timeout.
 * A timeout or an adapter exception becomes a failed result; nothing is retried here.
 * A timed-out call is cancelled with interruption. While an adapter call for an appliance is
 * still running, further commands to that appliance are refused, so a device that ignores
 * interruption holds at most one pool thread.
 */
@Slf4j
@Component
public class DeviceActuator {

    private final DeviceAdapter deviceAdapter;
    private final TimeLimiter timeLimiter;
    private final AsyncTaskExecutor actuationExecutor;
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    public DeviceActuator(DeviceAdapter deviceAdapter,
                          TimeLimiter actuationTimeLimiter,
                          @Qualifier("actuationExecutor") AsyncTaskExecutor actuationExecutor) {
        this.deviceAdapter = deviceAdapter;
        this.timeLimiter = actuationTimeLimiter;
        this.actuationExecutor = actuationExecutor;
    }

    public ActuationResult actuate(Long applianceId, ActuationCommand command) {
        long started = System.currentTimeMillis();
        if (inFlight.contains(applianceId)) {
            log.warn("Actuation {} on appliance {} skipped: previous call still running", command, applianceId);
            return ActuationResult.failure("Previous command still in flight");
        }
        Callable<ActuationResult> call = () -> {
            inFlight.add(applianceId);
            try {
                return deviceAdapter.setPower(applianceId, command);
            } finally {
                inFlight.remove(applianceId);
            }
        };
        Callable<ActuationResult> timed = TimeLimiter.decorateFutureSupplier(timeLimiter,
            () -> actuationExecutor.submit(call));
        ActuationResult result;
        try {
            result = timed.call();
        } catch (TimeoutException e) {
            log.warn("Actuation {} on appliance {} timed out after {}", command, applianceId,
                timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            result = ActuationResult.failure("Timed out");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = ActuationResult.failure("Interrupted");
        } catch (Exception e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Actuation {} on appliance {} failed: {}", command, applianceId, cause.getMessage());
            result = ActuationResult.failure(cause.getMessage());
        }
        if (result == null) {
            result = ActuationResult.failure("Adapter returned no result");
        }
        result.setResponseTimeMs(System.currentTimeMillis() - started);
        return result;
    }

    boolean isInFlight(Long applianceId) {
        return inFlight.contains(applianceId);
    }
}
