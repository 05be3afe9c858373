package com.lynkvertx.gridpilot.controller;

import com.lynkvertx.gridpilot.dto.ApiResponse;
import com.lynkvertx.gridpilot.dto.CarbonIntensityDTO;
import com.lynkvertx.gridpilot.dto.CarbonIntensityDTO.CarbonProfileBatchDTO;
import com.lynkvertx.gridpilot.dto.TariffSlotDTO;
import com.lynkvertx.gridpilot.dto.TariffSlotDTO.TariffSlotBatchDTO;
import com.lynkvertx.gridpilot.service.ReferenceTableService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import java.util.List;

/**
 * Tariff plan and carbon region reference data
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Reference Tables", description = "Tariff slot and carbon intensity APIs")
public class ReferenceTableController {

    private final ReferenceTableService referenceTableService;

    @GetMapping("/tariff-plans/{planId}/slots")
    @Operation(summary = "Get tariff slots")
    public ResponseEntity<ApiResponse<List<TariffSlotDTO>>> getTariffSlots(@PathVariable String planId) {
        return ResponseEntity.ok(ApiResponse.success(referenceTableService.getTariffSlots(planId)));
    }

    @PutMapping("/tariff-plans/{planId}/slots")
    @Operation(summary = "Replace tariff slots",
        description = "Slots must cover the 24 hours exactly once; overlaps and gaps are rejected")
    public ResponseEntity<ApiResponse<List<TariffSlotDTO>>> replaceTariffSlots(
            @PathVariable String planId,
            @Valid @RequestBody TariffSlotBatchDTO batch) {
        List<TariffSlotDTO> saved = referenceTableService.replaceTariffSlots(planId, batch.getSlots());
        return ResponseEntity.ok(ApiResponse.success("Tariff slots saved successfully", saved));
    }

    @GetMapping("/carbon-regions/{regionCode}/intensities")
    @Operation(summary = "Get carbon intensities")
    public ResponseEntity<ApiResponse<List<CarbonIntensityDTO>>> getCarbonIntensities(@PathVariable String regionCode) {
        return ResponseEntity.ok(ApiResponse.success(referenceTableService.getCarbonIntensities(regionCode)));
    }

    @PutMapping("/carbon-regions/{regionCode}/intensities")
    @Operation(summary = "Replace carbon profile", description = "Hourly gCO2/kWh values for the region")
    public ResponseEntity<ApiResponse<List<CarbonIntensityDTO>>> replaceCarbonIntensities(
            @PathVariable String regionCode,
            @Valid @RequestBody CarbonProfileBatchDTO batch) {
        List<CarbonIntensityDTO> saved = referenceTableService.replaceCarbonIntensities(regionCode, batch);
        return ResponseEntity.ok(ApiResponse.success("Carbon intensities saved successfully", saved));
    }
}
