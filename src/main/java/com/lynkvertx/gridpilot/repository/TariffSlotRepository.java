package com.lynkvertx.gridpilot.repository;

import com.lynkvertx.gridpilot.entity.TariffSlot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Tariff Slot Repository
 */
@Repository
public interface TariffSlotRepository extends JpaRepository<TariffSlot, Long> {

    List<TariffSlot> findByPlanIdOrderByStartHourAsc(String planId);

    void deleteByPlanId(String planId);
}
