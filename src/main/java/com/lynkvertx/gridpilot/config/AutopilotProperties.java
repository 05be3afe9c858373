package com.lynkvertx.gridpilot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration properties for the autopilot engine.
 * Thresholds, timing and rounding rules are externalized here so the
 * decision engine can be tuned via application.yml without code changes.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "gridpilot.autopilot")
public class AutopilotProperties {

    /** Penalty above which the strategy guard applies the device's preferred action */
    private double penaltyThreshold = 0.6;

    /** Local time zone used for hour-of-day lookups and protected windows */
    private String timezone = "Asia/Kolkata";

    /** Run the periodic control loop at all (disabled in tests) */
    private boolean schedulerEnabled = true;

    /** Control loop period in milliseconds */
    private long tickIntervalMs = 60_000L;

    /** INTERVAL evaluates on every tick, SLOT_TRANSITION only when a rate or intensity changes hour to hour */
    private TriggerMode triggerMode = TriggerMode.INTERVAL;

    /** Worker threads used to evaluate devices concurrently */
    private int workerThreads = 8;

    /** Upper bound for a single device actuation call */
    private Duration actuationTimeout = Duration.ofSeconds(5);

    /** Re-read and re-evaluate attempts when an optimistic claim loses the race */
    private int conflictRetryLimit = 3;

    /** Override horizon when no later hour drops below the threshold */
    private int overrideFallbackHours = 24;

    /** How long hour-indexed reference tables stay cached per plan/region */
    private Duration referenceCacheTtl = Duration.ofMinutes(10);

    /** Decimal places for money amounts */
    private int costScale = 2;

    /** Decimal places for carbon mass in grams */
    private int carbonScale = 1;

    /** Appliance categories that support eco mode / power limiting */
    private List<String> ecoCapableCategories = Arrays.asList("ac", "washing_machine", "refrigerator");

    /** Frontend origins allowed by CORS */
    private List<String> corsAllowedOrigins = Arrays.asList("http://localhost:*", "http://127.0.0.1:*");

    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }

    public enum TriggerMode {
        INTERVAL,
        SLOT_TRANSITION
    }
}
