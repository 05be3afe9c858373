package com.lynkvertx.gridpilot.repository;

import com.lynkvertx.gridpilot.entity.ControlLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Control Log Repository
 */
@Repository
public interface ControlLogRepository extends JpaRepository<ControlLog, Long> {

    List<ControlLog> findTop100ByApplianceIdOrderByLoggedAtDescIdDesc(Long applianceId);

    long countByApplianceId(Long applianceId);
}
