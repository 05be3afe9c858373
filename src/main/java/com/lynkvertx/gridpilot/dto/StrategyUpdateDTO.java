package com.lynkvertx.gridpilot.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Pattern;

/**
 * Strategy setter body
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StrategyUpdateDTO {

    @NotBlank(message = "strategy is required")
    @Pattern(regexp = "balanced|maxSavings|eco", message = "strategy must be one of balanced, maxSavings, eco")
    private String strategy;
}
