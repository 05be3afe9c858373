package com.lynkvertx.gridpilot.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.lynkvertx.gridpilot.calculation.HourlyCarbonTable;
import com.lynkvertx.gridpilot.calculation.HourlyTariffTable;
import com.lynkvertx.gridpilot.config.AutopilotProperties;
import com.lynkvertx.gridpilot.dto.CarbonIntensityDTO;
import com.lynkvertx.gridpilot.dto.CarbonIntensityDTO.CarbonProfileBatchDTO;
import com.lynkvertx.gridpilot.dto.TariffSlotDTO;
import com.lynkvertx.gridpilot.entity.CarbonIntensity;
import com.lynkvertx.gridpilot.entity.TariffSlot;
import com.lynkvertx.gridpilot.repository.CarbonIntensityRepository;
import com.lynkvertx.gridpilot.repository.TariffSlotRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tariff plans and carbon profiles.
 *
 * Hour-indexed tables are built once per plan/region and cached; saves replace the whole
 * table (delete-then-insert in one transaction) after validating it, then evict the cache.
 * A plan or region with no rows yields an empty table, so costs and carbon degrade to zero.
 */
@Slf4j
@Service
public class ReferenceTableService {

    private final TariffSlotRepository tariffSlotRepository;
    private final CarbonIntensityRepository carbonIntensityRepository;
    private final Clock clock;
    private final Cache<String, HourlyTariffTable> tariffTables;
    private final Cache<String, HourlyCarbonTable> carbonTables;

    public ReferenceTableService(TariffSlotRepository tariffSlotRepository,
                                 CarbonIntensityRepository carbonIntensityRepository,
                                 AutopilotProperties properties,
                                 Clock clock) {
        this.tariffSlotRepository = tariffSlotRepository;
        this.carbonIntensityRepository = carbonIntensityRepository;
        this.clock = clock;
        this.tariffTables = Caffeine.newBuilder()
            .expireAfterWrite(properties.getReferenceCacheTtl())
            .maximumSize(1_000)
            .build();
        this.carbonTables = Caffeine.newBuilder()
            .expireAfterWrite(properties.getReferenceCacheTtl())
            .maximumSize(1_000)
            .build();
    }

    public HourlyTariffTable tariffTable(String planId) {
        if (planId == null || planId.isEmpty()) {
            log.warn("Home has no tariff plan; cost signals are zero");
            return HourlyTariffTable.empty();
        }
        return tariffTables.get(planId, this::loadTariffTable);
    }

    public HourlyCarbonTable carbonTable(String regionCode) {
        if (regionCode == null || regionCode.isEmpty()) {
            log.warn("Home has no carbon region; carbon signals are zero");
            return HourlyCarbonTable.empty();
        }
        return carbonTables.get(regionCode, this::loadCarbonTable);
    }

    public List<TariffSlotDTO> getTariffSlots(String planId) {
        return tariffSlotRepository.findByPlanIdOrderByStartHourAsc(planId)
            .stream()
            .map(this::toDTO)
            .collect(Collectors.toList());
    }

    public List<CarbonIntensityDTO> getCarbonIntensities(String regionCode) {
        return carbonIntensityRepository.findByRegionCodeAndActiveTrueOrderByHourOfDayAscEffectiveFromDesc(regionCode)
            .stream()
            .map(this::toDTO)
            .collect(Collectors.toList());
    }

    /**
     * Replace every slot of a plan.
     *
     * @throws com.lynkvertx.gridpilot.exception.InvalidTimeRangeException if the slots do not partition the day
     */
    @Transactional
    public List<TariffSlotDTO> replaceTariffSlots(String planId, List<TariffSlotDTO> slots) {
        List<TariffSlot> entities = slots.stream()
            .map(dto -> TariffSlot.builder()
                .planId(planId)
                .label(dto.getLabel() != null ? dto.getLabel() : dto.getSlotType())
                .startHour(dto.getStartHour())
                .endHour(dto.getEndHour())
                .rate(dto.getRate())
                .slotType(dto.getSlotType() != null ? dto.getSlotType() : "normal")
                .build())
            .collect(Collectors.toList());

        // Rejects gaps and overlaps before anything is written
        HourlyTariffTable.of(entities);

        tariffSlotRepository.deleteByPlanId(planId);
        tariffSlotRepository.flush();
        List<TariffSlot> saved = tariffSlotRepository.saveAll(entities);
        tariffTables.invalidate(planId);
        log.info("Saved {} tariff slots for plan: {}", saved.size(), planId);

        return saved.stream().map(this::toDTO).collect(Collectors.toList());
    }

    /**
     * Replace the carbon profile of a region.
     *
     * @throws com.lynkvertx.gridpilot.exception.InvalidTimeRangeException if an hour is missing or out of range
     */
    @Transactional
    public List<CarbonIntensityDTO> replaceCarbonIntensities(String regionCode, CarbonProfileBatchDTO batch) {
        LocalDate defaultFrom = batch.getEffectiveFrom() != null ? batch.getEffectiveFrom() : LocalDate.now(clock);
        String defaultSource = batch.getSource() != null ? batch.getSource() : "manual";

        List<CarbonIntensity> entities = batch.getIntensities().stream()
            .map(dto -> CarbonIntensity.builder()
                .regionCode(regionCode)
                .hourOfDay(dto.getHour())
                .intensity(dto.getIntensity())
                .source(dto.getSource() != null ? dto.getSource() : defaultSource)
                .effectiveFrom(dto.getEffectiveFrom() != null ? dto.getEffectiveFrom() : defaultFrom)
                .active(dto.getActive() == null || dto.getActive())
                .build())
            .collect(Collectors.toList());

        HourlyCarbonTable.of(entities);

        carbonIntensityRepository.deleteByRegionCode(regionCode);
        carbonIntensityRepository.flush();
        List<CarbonIntensity> saved = carbonIntensityRepository.saveAll(entities);
        carbonTables.invalidate(regionCode);
        log.info("Saved {} carbon intensity rows for region: {}", saved.size(), regionCode);

        return saved.stream().map(this::toDTO).collect(Collectors.toList());
    }

    private HourlyTariffTable loadTariffTable(String planId) {
        List<TariffSlot> slots = tariffSlotRepository.findByPlanIdOrderByStartHourAsc(planId);
        if (slots.isEmpty()) {
            log.warn("No tariff slots configured for plan {}; cost signals are zero", planId);
            return HourlyTariffTable.empty();
        }
        return HourlyTariffTable.of(slots);
    }

    private HourlyCarbonTable loadCarbonTable(String regionCode) {
        List<CarbonIntensity> rows =
            carbonIntensityRepository.findByRegionCodeAndActiveTrueOrderByHourOfDayAscEffectiveFromDesc(regionCode);
        if (rows.isEmpty()) {
            log.warn("No carbon profile configured for region {}; carbon signals are zero", regionCode);
            return HourlyCarbonTable.empty();
        }
        return HourlyCarbonTable.of(rows);
    }

    private TariffSlotDTO toDTO(TariffSlot entity) {
        return TariffSlotDTO.builder()
            .id(entity.getId())
            .planId(entity.getPlanId())
            .label(entity.getLabel())
            .startHour(entity.getStartHour())
            .endHour(entity.getEndHour())
            .rate(entity.getRate())
            .slotType(entity.getSlotType())
            .build();
    }

    private CarbonIntensityDTO toDTO(CarbonIntensity entity) {
        return CarbonIntensityDTO.builder()
            .id(entity.getId())
            .regionCode(entity.getRegionCode())
            .hour(entity.getHourOfDay())
            .intensity(entity.getIntensity())
            .source(entity.getSource())
            .effectiveFrom(entity.getEffectiveFrom())
            .active(entity.isActive())
            .build();
    }
}
