package com.lynkvertx.gridpilot.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotNull;

/**
 * Body of the on/off setters (autopilot enabled, grid protection)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FlagUpdateDTO {

    @NotNull(message = "enabled is required")
    private Boolean enabled;
}
