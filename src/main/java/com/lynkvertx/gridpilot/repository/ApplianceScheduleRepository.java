package com.lynkvertx.gridpilot.repository;

import com.lynkvertx.gridpilot.entity.ApplianceSchedule;
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
 * Appliance Schedule Repository
 */
@Repository
public interface ApplianceScheduleRepository extends JpaRepository<ApplianceSchedule, Long> {

    Optional<ApplianceSchedule> findByApplianceIdAndActiveTrue(Long applianceId);

    List<ApplianceSchedule> findByActiveTrue();

    long countByApplianceIdAndActiveTrue(Long applianceId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ApplianceSchedule s set s.active = false, s.activeApplianceId = null "
        + "where s.applianceId = :applianceId and s.active = true")
    int retireActive(@Param("applianceId") Long applianceId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ApplianceSchedule s set s.lastExecuted = :at where s.id = :id")
    int markExecuted(@Param("id") Long id, @Param("at") LocalDateTime at);
}
