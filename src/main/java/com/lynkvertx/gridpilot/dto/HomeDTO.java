package com.lynkvertx.gridpilot.dto;

import com.lynkvertx.gridpilot.entity.AutopilotStrategy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Size;
import java.time.LocalDateTime;

/**
 * Home Data Transfer Object
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HomeDTO {

    private Long id;

    @NotBlank(message = "Home name is required")
    @Size(max = 255, message = "Home name must not exceed 255 characters")
    private String name;

    /** Tariff plan the home is billed on */
    @Size(max = 64)
    private String tariffPlanId;

    /** Carbon region, e.g. IN-BR */
    @Size(max = 16)
    private String regionCode;

    /** Grid operator (DISCOM) serving the home */
    @Size(max = 64)
    private String discomId;

    private Boolean autopilotEnabled;

    private AutopilotStrategy strategy;

    private Boolean gridProtectionEnabled;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
