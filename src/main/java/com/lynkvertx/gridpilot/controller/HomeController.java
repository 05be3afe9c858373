package com.lynkvertx.gridpilot.controller;

import com.lynkvertx.gridpilot.dto.ApiResponse;
import com.lynkvertx.gridpilot.dto.HomeDTO;
import com.lynkvertx.gridpilot.service.HomeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import java.util.List;

/**
 * Home REST Controller
 */
@RestController
@RequestMapping("/api/homes")
@RequiredArgsConstructor
@Tag(name = "Home Management", description = "Home registration APIs")
public class HomeController {

    private final HomeService homeService;

    @GetMapping
    @Operation(summary = "Get all homes", description = "List registered homes, newest first")
    public ResponseEntity<ApiResponse<List<HomeDTO>>> getAllHomes() {
        return ResponseEntity.ok(ApiResponse.success(homeService.getAllHomes()));
    }

    @GetMapping("/{homeId}")
    @Operation(summary = "Get home by ID")
    public ResponseEntity<ApiResponse<HomeDTO>> getHome(@PathVariable Long homeId) {
        return ResponseEntity.ok(ApiResponse.success(homeService.getHomeById(homeId)));
    }

    @PostMapping
    @Operation(summary = "Create home", description = "Register a home with its tariff plan, carbon region and DISCOM")
    public ResponseEntity<ApiResponse<HomeDTO>> createHome(@Valid @RequestBody HomeDTO dto) {
        HomeDTO created = homeService.createHome(dto);
        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(ApiResponse.success("Home created successfully", created));
    }
}
