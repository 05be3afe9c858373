package com.lynkvertx.gridpilot.repository;

import com.lynkvertx.gridpilot.entity.Appliance;
import com.lynkvertx.gridpilot.entity.ApplianceStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import javax.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

/**
 * Appliance Repository
 */
@Repository
public interface ApplianceRepository extends JpaRepository<Appliance, Long> {

    List<Appliance> findByHomeId(Long homeId);

    /**
     * Row lock on the appliance, used to serialize schedule mutations per appliance
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from Appliance a where a.id = :id")
    Optional<Appliance> findByIdForUpdate(@Param("id") Long id);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Appliance a set a.status = :status where a.id = :id")
    int updateStatus(@Param("id") Long id, @Param("status") ApplianceStatus status);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Appliance a set a.ecoModeEnabled = :enabled where a.id = :id")
    int updateEcoMode(@Param("id") Long id, @Param("enabled") boolean enabled);
}
