package com.lynkvertx.gridpilot.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Bounded timeout for device actuation calls.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public TimeLimiter actuationTimeLimiter(AutopilotProperties properties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
            .timeoutDuration(properties.getActuationTimeout())
            .cancelRunningFuture(true)
            .build();
        return TimeLimiter.of("deviceActuation", config);
    }
}
