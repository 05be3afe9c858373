package com.lynkvertx.gridpilot.dto;

import com.lynkvertx.gridpilot.entity.ApplianceStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Size;

/**
 * Appliance Data Transfer Object
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApplianceDTO {

    private Long id;

    private Long homeId;

    @NotBlank(message = "Appliance name is required")
    @Size(max = 255)
    private String name;

    /** ac, geyser, washing_machine, refrigerator, ... */
    @NotBlank(message = "Category is required")
    @Size(max = 40)
    private String category;

    @NotNull(message = "Rated power is required")
    @Min(value = 0, message = "Rated power must be non-negative")
    private Integer ratedPowerW;

    private ApplianceStatus status;

    private Boolean ecoModeEnabled;

    private Boolean controllable;
}
