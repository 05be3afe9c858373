package com.lynkvertx.gridpilot.controller;

import com.lynkvertx.gridpilot.dto.ApiResponse;
import com.lynkvertx.gridpilot.dto.AutopilotStatusDTO;
import com.lynkvertx.gridpilot.dto.FlagUpdateDTO;
import com.lynkvertx.gridpilot.dto.StrategyUpdateDTO;
import com.lynkvertx.gridpilot.dto.TickReportDTO;
import com.lynkvertx.gridpilot.service.AutopilotTickService;
import com.lynkvertx.gridpilot.service.HomeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;

/**
 * Home level autopilot settings and on-demand evaluation
 */
@RestController
@RequestMapping("/api/homes/{homeId}/autopilot")
@RequiredArgsConstructor
@Tag(name = "Autopilot", description = "Autopilot strategy, grid protection and evaluation APIs")
public class AutopilotController {

    private final HomeService homeService;
    private final AutopilotTickService tickService;

    @GetMapping
    @Operation(summary = "Get autopilot status")
    public ResponseEntity<ApiResponse<AutopilotStatusDTO>> getStatus(@PathVariable Long homeId) {
        return ResponseEntity.ok(ApiResponse.success(homeService.getAutopilotStatus(homeId)));
    }

    @PutMapping("/strategy")
    @Operation(summary = "Set strategy", description = "One of balanced, maxSavings, eco")
    public ResponseEntity<ApiResponse<AutopilotStatusDTO>> updateStrategy(
            @PathVariable Long homeId,
            @Valid @RequestBody StrategyUpdateDTO request) {
        AutopilotStatusDTO status = homeService.updateStrategy(homeId, request.getStrategy());
        return ResponseEntity.ok(ApiResponse.success("Strategy updated successfully", status));
    }

    @PutMapping("/grid-protection")
    @Operation(summary = "Enable or disable grid protection")
    public ResponseEntity<ApiResponse<AutopilotStatusDTO>> updateGridProtection(
            @PathVariable Long homeId,
            @Valid @RequestBody FlagUpdateDTO request) {
        AutopilotStatusDTO status = homeService.updateGridProtection(homeId, request.getEnabled());
        return ResponseEntity.ok(ApiResponse.success("Grid protection updated successfully", status));
    }

    @PutMapping("/enabled")
    @Operation(summary = "Enable or disable autopilot")
    public ResponseEntity<ApiResponse<AutopilotStatusDTO>> updateEnabled(
            @PathVariable Long homeId,
            @Valid @RequestBody FlagUpdateDTO request) {
        AutopilotStatusDTO status = homeService.updateAutopilotEnabled(homeId, request.getEnabled());
        return ResponseEntity.ok(ApiResponse.success("Autopilot updated successfully", status));
    }

    @GetMapping("/preview")
    @Operation(summary = "Preview decisions", description = "Dry run of one evaluation; nothing is actuated")
    public ResponseEntity<ApiResponse<TickReportDTO>> preview(@PathVariable Long homeId) {
        return ResponseEntity.ok(ApiResponse.success(tickService.preview(homeId)));
    }

    @PostMapping("/evaluate")
    @Operation(summary = "Evaluate now", description = "Run one evaluation of the home outside the periodic tick")
    public ResponseEntity<ApiResponse<TickReportDTO>> evaluate(@PathVariable Long homeId) {
        return ResponseEntity.ok(ApiResponse.success(tickService.evaluateHome(homeId)));
    }
}
