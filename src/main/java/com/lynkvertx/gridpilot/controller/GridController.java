package com.lynkvertx.gridpilot.controller;

import com.lynkvertx.gridpilot.dto.ApiResponse;
import com.lynkvertx.gridpilot.dto.GridEventDTO;
import com.lynkvertx.gridpilot.dto.GridStatusDTO;
import com.lynkvertx.gridpilot.service.GridProtectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;

@RestController
@RequestMapping("/api/grid")
@RequiredArgsConstructor
@Tag(name = "Grid", description = "Grid event ingestion and status APIs")
public class GridController {

    private final GridProtectionService gridProtectionService;

    @PostMapping("/events")
    @Operation(summary = "Ingest grid event", description = "Record a DISCOM event; critical events trigger grid protection")
    public ResponseEntity<ApiResponse<GridEventDTO>> ingestEvent(@Valid @RequestBody GridEventDTO dto) {
        GridEventDTO saved = gridProtectionService.ingestEvent(dto);
        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(ApiResponse.success("Grid event recorded", saved));
    }

    @GetMapping("/{discomId}/status")
    @Operation(summary = "Grid status", description = "Live reading merged with events currently in effect")
    public ResponseEntity<ApiResponse<GridStatusDTO>> getStatus(@PathVariable String discomId) {
        return ResponseEntity.ok(ApiResponse.success(gridProtectionService.getStatus(discomId)));
    }
}
