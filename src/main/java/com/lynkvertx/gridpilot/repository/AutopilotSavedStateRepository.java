package com.lynkvertx.gridpilot.repository;

import com.lynkvertx.gridpilot.entity.AutopilotSavedState;
import com.lynkvertx.gridpilot.entity.BaselineTrigger;
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
 * Autopilot Saved State Repository
 */
@Repository
public interface AutopilotSavedStateRepository extends JpaRepository<AutopilotSavedState, Long> {

    Optional<AutopilotSavedState> findByApplianceIdAndTriggerType(Long applianceId, BaselineTrigger triggerType);

    List<AutopilotSavedState> findByHomeIdAndTriggerTypeAndRestoredAtIsNull(Long homeId, BaselineTrigger triggerType);

    boolean existsByHomeIdAndTriggerTypeAndRestoredAtIsNull(Long homeId, BaselineTrigger triggerType);

    /**
     * Mark a baseline restored; matches nothing if another tick restored it first
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update AutopilotSavedState s set s.restoredAt = :now where s.id = :id and s.restoredAt is null")
    int markRestored(@Param("id") Long id, @Param("now") LocalDateTime now);
}
