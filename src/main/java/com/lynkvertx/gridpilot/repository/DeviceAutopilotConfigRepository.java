package com.lynkvertx.gridpilot.repository;

import com.lynkvertx.gridpilot.entity.DeviceAutopilotConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Device Autopilot Config Repository.
 * Every write the control loop issues here is conditioned on the state it read,
 * so concurrent ticks and user actions cannot overwrite each other silently.
 */
@Repository
public interface DeviceAutopilotConfigRepository extends JpaRepository<DeviceAutopilotConfig, Long> {

    Optional<DeviceAutopilotConfig> findByApplianceId(Long applianceId);

    List<DeviceAutopilotConfig> findByHomeIdAndDelegatedTrue(Long homeId);

    /**
     * Claim a config for applying a decision: succeeds only if nobody changed it since it was read
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update DeviceAutopilotConfig c set c.lastEvaluatedAt = :now, c.version = c.version + 1 "
        + "where c.id = :id and c.version = :version")
    int claimIfUnchanged(@Param("id") Long id, @Param("version") Long version, @Param("now") LocalDateTime now);

    /**
     * Clear an override only once its expiry has passed
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update DeviceAutopilotConfig c set c.overrideActive = false, c.overrideUntil = null, "
        + "c.version = c.version + 1 "
        + "where c.applianceId = :applianceId and c.overrideActive = true "
        + "and c.overrideUntil is not null and c.overrideUntil <= :now")
    int clearExpiredOverride(@Param("applianceId") Long applianceId, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update DeviceAutopilotConfig c set c.overrideActive = true, c.overrideUntil = :until, "
        + "c.version = c.version + 1 "
        + "where c.applianceId = :applianceId and c.delegated = true")
    int raiseOverride(@Param("applianceId") Long applianceId, @Param("until") LocalDateTime until);

    /**
     * Strategy-restore: drop every active override of a home
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update DeviceAutopilotConfig c set c.overrideActive = false, c.overrideUntil = null, "
        + "c.version = c.version + 1 "
        + "where c.homeId = :homeId and c.overrideActive = true")
    int clearOverridesForHome(@Param("homeId") Long homeId);
}
