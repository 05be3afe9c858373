package com.lynkvertx.gridpilot.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the periodic control loop and the schedule runner.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "gridpilot.autopilot", name = "scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
