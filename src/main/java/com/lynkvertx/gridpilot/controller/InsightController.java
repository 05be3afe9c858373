package com.lynkvertx.gridpilot.controller;

import com.lynkvertx.gridpilot.dto.ApiResponse;
import com.lynkvertx.gridpilot.dto.CarbonNowDTO;
import com.lynkvertx.gridpilot.dto.PenaltyTimelineDTO;
import com.lynkvertx.gridpilot.service.CarbonStatusService;
import com.lynkvertx.gridpilot.service.PenaltyTimelineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/homes/{homeId}")
@RequiredArgsConstructor
@Tag(name = "Insights", description = "Penalty timeline and carbon status APIs")
public class InsightController {

    private final PenaltyTimelineService penaltyTimelineService;
    private final CarbonStatusService carbonStatusService;

    @GetMapping("/penalty-timeline")
    @Operation(summary = "Penalty timeline", description = "24 hourly penalties under the home's strategy")
    public ResponseEntity<ApiResponse<PenaltyTimelineDTO>> getPenaltyTimeline(@PathVariable Long homeId) {
        return ResponseEntity.ok(ApiResponse.success(penaltyTimelineService.getPenaltyTimeline(homeId)));
    }

    @GetMapping("/carbon-now")
    @Operation(summary = "Carbon now", description = "Current intensity, daily mean and cleanest hours")
    public ResponseEntity<ApiResponse<CarbonNowDTO>> getCarbonNow(@PathVariable Long homeId) {
        return ResponseEntity.ok(ApiResponse.success(carbonStatusService.getCarbonNow(homeId)));
    }
}
