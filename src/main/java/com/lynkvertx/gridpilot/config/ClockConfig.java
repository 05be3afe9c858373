package com.lynkvertx.gridpilot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Clock bound to the configured local time zone.
 * Every time-of-day decision reads from this bean.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(AutopilotProperties properties) {
        return Clock.system(properties.zoneId());
    }
}
