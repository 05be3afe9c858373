package com.lynkvertx.gridpilot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotNull;
import javax.validation.constraints.Pattern;

/**
 * A human switching a device from the app or at the wall
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToggleRequestDTO {

    @NotNull(message = "Target state is required")
    private Boolean on;

    /** user (app) or physical (switch) */
    @Pattern(regexp = "user|physical", message = "Source must be 'user' or 'physical'")
    private String source;
}
