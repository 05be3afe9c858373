package com.lynkvertx.gridpilot.adapter;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class DeviceActuatorTest {

    private final CountDownLatch release = new CountDownLatch(1);
    private ThreadPoolTaskExecutor pool;

    @BeforeEach
    void setUp() {
        pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(2);
        pool.setMaxPoolSize(2);
        pool.setQueueCapacity(10);
        pool.setThreadNamePrefix("actuation-test-");
        pool.initialize();
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        pool.shutdown();
    }

    private DeviceActuator actuator(DeviceAdapter adapter, Duration timeout) {
        TimeLimiter limiter = TimeLimiter.of(TimeLimiterConfig.custom()
            .timeoutDuration(timeout)
            .cancelRunningFuture(true)
            .build());
        return new DeviceActuator(adapter, limiter, pool);
    }

    @Test
    void successfulCallCarriesResponseTime() {
        ActuationResult result = actuator((id, command) -> ActuationResult.ok("done"), Duration.ofSeconds(1))
            .actuate(1L, ActuationCommand.TURN_ON);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getResponseTimeMs()).isGreaterThanOrEqualTo(0);
    }

    @Test
    void hungDeviceTimesOut() {
        DeviceAdapter hung = (id, command) -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ActuationResult.ok("too late");
        };

        ActuationResult result = actuator(hung, Duration.ofMillis(100)).actuate(1L, ActuationCommand.TURN_OFF);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo("Timed out");
    }

    @Test
    void repeatedTimeoutsOnOneDeviceLeaveThePoolFreeForOthers() throws InterruptedException {
        AtomicInteger interrupted = new AtomicInteger();
        DeviceAdapter adapter = (id, command) -> {
            if (id == 2L) {
                return ActuationResult.ok("switched");
            }
            try {
                release.await();
            } catch (InterruptedException e) {
                interrupted.incrementAndGet();
                Thread.currentThread().interrupt();
                return ActuationResult.failure("Interrupted by caller");
            }
            return ActuationResult.ok("too late");
        };
        DeviceActuator actuator = actuator(adapter, Duration.ofMillis(200));

        ActuationResult firstTick = actuator.actuate(1L, ActuationCommand.TURN_OFF);
        awaitIdle(actuator, 1L);
        ActuationResult secondTick = actuator.actuate(1L, ActuationCommand.TURN_OFF);
        awaitIdle(actuator, 1L);
        ActuationResult thirdTick = actuator.actuate(1L, ActuationCommand.TURN_OFF);
        awaitIdle(actuator, 1L);
        ActuationResult healthy = actuator.actuate(2L, ActuationCommand.TURN_OFF);

        assertThat(firstTick.getMessage()).isEqualTo("Timed out");
        assertThat(secondTick.getMessage()).isEqualTo("Timed out");
        assertThat(thirdTick.getMessage()).isEqualTo("Timed out");
        assertThat(healthy.isSuccess()).isTrue();
        assertThat(healthy.getMessage()).isEqualTo("switched");

        awaitActiveCount(0);
        assertThat(interrupted.get()).isEqualTo(3);
        assertThat(pool.getActiveCount()).isZero();
    }

    @Test
    void deviceIgnoringInterruptionHoldsAtMostOneThread() throws InterruptedException {
        CountDownLatch entered = new CountDownLatch(1);
        DeviceAdapter adapter = (id, command) -> {
            if (id == 2L) {
                return ActuationResult.ok("switched");
            }
            entered.countDown();
            boolean released = false;
            while (!released) {
                try {
                    released = release.await(50, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    // keeps waiting, like firmware that never honours cancellation
                    released = false;
                }
            }
            return ActuationResult.ok("too late");
        };
        DeviceActuator actuator = actuator(adapter, Duration.ofMillis(200));

        ActuationResult firstTick = actuator.actuate(1L, ActuationCommand.TURN_OFF);
        assertThat(entered.await(1, TimeUnit.SECONDS)).isTrue();
        ActuationResult secondTick = actuator.actuate(1L, ActuationCommand.TURN_OFF);
        ActuationResult healthy = actuator.actuate(2L, ActuationCommand.TURN_OFF);

        assertThat(firstTick.getMessage()).isEqualTo("Timed out");
        assertThat(secondTick.isSuccess()).isFalse();
        assertThat(secondTick.getMessage()).isEqualTo("Previous command still in flight");
        assertThat(actuator.isInFlight(1L)).isTrue();
        assertThat(healthy.isSuccess()).isTrue();
        awaitActiveCount(1);
        assertThat(pool.getActiveCount()).isEqualTo(1);
    }

    private static void awaitIdle(DeviceActuator actuator, Long applianceId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2_000;
        while (actuator.isInFlight(applianceId) && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
    }

    private void awaitActiveCount(int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2_000;
        while (pool.getActiveCount() > expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
    }

    @Test
    void adapterExceptionBecomesFailure() {
        DeviceAdapter broken = (id, command) -> {
            throw new IllegalStateException("No route to device");
        };

        ActuationResult result = actuator(broken, Duration.ofSeconds(1)).actuate(1L, ActuationCommand.ECO_ON);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo("No route to device");
    }
}
