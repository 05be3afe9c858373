package com.lynkvertx.gridpilot.controller;

import com.lynkvertx.gridpilot.calculation.ScheduleWindow;
import com.lynkvertx.gridpilot.calculation.WindowOptions;
import com.lynkvertx.gridpilot.dto.ApiResponse;
import com.lynkvertx.gridpilot.dto.ApplianceDTO;
import com.lynkvertx.gridpilot.dto.ControlLogDTO;
import com.lynkvertx.gridpilot.dto.DeviceAutopilotConfigDTO;
import com.lynkvertx.gridpilot.dto.ScheduleDTO;
import com.lynkvertx.gridpilot.dto.ScheduleRequestDTO;
import com.lynkvertx.gridpilot.dto.ToggleRequestDTO;
import com.lynkvertx.gridpilot.service.ApplianceService;
import com.lynkvertx.gridpilot.service.AuditService;
import com.lynkvertx.gridpilot.service.DeviceConfigService;
import com.lynkvertx.gridpilot.service.ScheduleOptionService;
import com.lynkvertx.gridpilot.service.ScheduleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import java.util.List;

/**
 * Appliance REST Controller: registration, manual control, delegation, schedules and logs
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Appliances", description = "Appliance control, autopilot delegation and scheduling APIs")
public class ApplianceController {

    private final ApplianceService applianceService;
    private final DeviceConfigService deviceConfigService;
    private final ScheduleOptionService scheduleOptionService;
    private final ScheduleService scheduleService;
    private final AuditService auditService;

    @GetMapping("/homes/{homeId}/appliances")
    @Operation(summary = "Get appliances of a home")
    public ResponseEntity<ApiResponse<List<ApplianceDTO>>> getAppliances(@PathVariable Long homeId) {
        return ResponseEntity.ok(ApiResponse.success(applianceService.getByHomeId(homeId)));
    }

    @PostMapping("/homes/{homeId}/appliances")
    @Operation(summary = "Register appliance")
    public ResponseEntity<ApiResponse<ApplianceDTO>> createAppliance(
            @PathVariable Long homeId,
            @Valid @RequestBody ApplianceDTO dto) {
        ApplianceDTO created = applianceService.createAppliance(homeId, dto);
        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(ApiResponse.success("Appliance created successfully", created));
    }

    @PostMapping("/appliances/{applianceId}/toggle")
    @Operation(summary = "Toggle appliance",
        description = "Manual on/off; on a delegated device this raises a user override")
    public ResponseEntity<ApiResponse<ApplianceDTO>> toggle(
            @PathVariable Long applianceId,
            @Valid @RequestBody ToggleRequestDTO request) {
        return ResponseEntity.ok(ApiResponse.success(applianceService.toggle(applianceId, request)));
    }

    @GetMapping("/appliances/{applianceId}/autopilot-config")
    @Operation(summary = "Get autopilot delegation config")
    public ResponseEntity<ApiResponse<DeviceAutopilotConfigDTO>> getConfig(@PathVariable Long applianceId) {
        return ResponseEntity.ok(ApiResponse.success(deviceConfigService.getConfig(applianceId)));
    }

    @PutMapping("/appliances/{applianceId}/autopilot-config")
    @Operation(summary = "Update autopilot delegation config",
        description = "Delegation flag, preferred action and protected window")
    public ResponseEntity<ApiResponse<DeviceAutopilotConfigDTO>> updateConfig(
            @PathVariable Long applianceId,
            @Valid @RequestBody DeviceAutopilotConfigDTO dto) {
        DeviceAutopilotConfigDTO updated = deviceConfigService.updateConfig(applianceId, dto);
        return ResponseEntity.ok(ApiResponse.success("Autopilot config updated successfully", updated));
    }

    @GetMapping("/appliances/{applianceId}/best-window")
    @Operation(summary = "Best start window",
        description = "Lowest weighted penalty start over the next 24 hours for a run of the given duration")
    public ResponseEntity<ApiResponse<ScheduleWindow>> getBestWindow(
            @PathVariable Long applianceId,
            @RequestParam double durationHours) {
        return ResponseEntity.ok(ApiResponse.success(scheduleOptionService.getBestWindow(applianceId, durationHours)));
    }

    @GetMapping("/appliances/{applianceId}/schedule-options")
    @Operation(summary = "Schedule options",
        description = "Run now, next cheaper, cheapest, best and an optional custom start with savings")
    public ResponseEntity<ApiResponse<WindowOptions>> getScheduleOptions(
            @PathVariable Long applianceId,
            @RequestParam double durationHours,
            @RequestParam(required = false) Integer customStartHour) {
        WindowOptions options = scheduleOptionService.getScheduleOptions(applianceId, durationHours, customStartHour);
        return ResponseEntity.ok(ApiResponse.success(options));
    }

    @PostMapping("/appliances/{applianceId}/schedule")
    @Operation(summary = "Set schedule", description = "Replaces the active schedule of the appliance")
    public ResponseEntity<ApiResponse<ScheduleDTO>> setSchedule(
            @PathVariable Long applianceId,
            @Valid @RequestBody ScheduleRequestDTO request) {
        ScheduleDTO saved = scheduleService.setSchedule(applianceId, request);
        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(ApiResponse.success("Schedule saved successfully", saved));
    }

    @GetMapping("/appliances/{applianceId}/schedule")
    @Operation(summary = "Get active schedule")
    public ResponseEntity<ApiResponse<ScheduleDTO>> getSchedule(@PathVariable Long applianceId) {
        return ResponseEntity.ok(ApiResponse.success(scheduleService.getActiveSchedule(applianceId)));
    }

    @GetMapping("/appliances/{applianceId}/control-logs")
    @Operation(summary = "Get control logs", description = "Latest 100 actuation audit entries")
    public ResponseEntity<ApiResponse<List<ControlLogDTO>>> getControlLogs(@PathVariable Long applianceId) {
        return ResponseEntity.ok(ApiResponse.success(auditService.getLogs(applianceId)));
    }
}
