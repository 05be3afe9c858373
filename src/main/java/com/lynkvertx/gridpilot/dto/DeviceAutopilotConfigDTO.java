package com.lynkvertx.gridpilot.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.lynkvertx.gridpilot.entity.PreferredAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Per-device delegation settings. Override fields are read-only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceAutopilotConfigDTO {

    private Long applianceId;
    private Long homeId;
    private PreferredAction preferredAction;
    private Boolean protectedWindowEnabled;

    @JsonFormat(pattern = "HH:mm")
    private LocalTime protectedWindowStart;

    @JsonFormat(pattern = "HH:mm")
    private LocalTime protectedWindowEnd;

    private Boolean delegated;
    private boolean overrideActive;
    private LocalDateTime overrideUntil;
    private LocalDateTime lastEvaluatedAt;
}
