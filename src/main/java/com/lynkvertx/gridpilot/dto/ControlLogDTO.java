package com.lynkvertx.gridpilot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Audit entry of a device action
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ControlLogDTO {

    private Long id;
    private Long applianceId;
    private String action;
    private String triggerSource;
    private String result;
    private String message;
    private Long responseTimeMs;
    private LocalDateTime loggedAt;
}
