package com.lynkvertx.gridpilot.repository;

import com.lynkvertx.gridpilot.entity.CarbonIntensity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Carbon Intensity Repository
 */
@Repository
public interface CarbonIntensityRepository extends JpaRepository<CarbonIntensity, Long> {

    /**
     * Active rows for a region, latest version first within each hour
     */
    List<CarbonIntensity> findByRegionCodeAndActiveTrueOrderByHourOfDayAscEffectiveFromDesc(String regionCode);

    void deleteByRegionCode(String regionCode);
}
