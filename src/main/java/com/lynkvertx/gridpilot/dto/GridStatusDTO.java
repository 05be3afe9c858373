package com.lynkvertx.gridpilot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Grid status of an operator: normal, stressed or critical
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GridStatusDTO {

    public static final String NORMAL = "normal";
    public static final String STRESSED = "stressed";
    public static final String CRITICAL = "critical";

    private String discomId;
    private String status;
    private Double frequencyHz;
    private Double voltageV;
    private String message;
    private List<GridEventDTO> activeEvents;
    private LocalDateTime checkedAt;
}
