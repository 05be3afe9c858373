package com.lynkvertx.gridpilot.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.lynkvertx.gridpilot.entity.RepeatType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

/**
 * Appliance schedule
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleDTO {

    private Long id;
    private Long applianceId;
    private Long homeId;

    @JsonFormat(pattern = "HH:mm")
    private LocalTime startTime;

    @JsonFormat(pattern = "HH:mm")
    private LocalTime endTime;

    private RepeatType repeatType;
    private List<Integer> customDays;
    private boolean active;
    private LocalDateTime lastExecuted;
    private String createdBy;
    private LocalDateTime createdAt;
}
