package com.lynkvertx.gridpilot.dto;

import com.lynkvertx.gridpilot.entity.GridSeverity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Grid operator event (load shedding, frequency dip, ...)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GridEventDTO {

    private Long id;

    @NotBlank(message = "discomId is required")
    private String discomId;

    @NotBlank(message = "eventType is required")
    private String eventType;

    @NotNull(message = "severity is required")
    private GridSeverity severity;

    private String message;

    /** Defaults to now */
    private LocalDateTime startTime;

    private LocalDateTime endTime;

    private List<String> affectedAreas;

    private Boolean active;
}
