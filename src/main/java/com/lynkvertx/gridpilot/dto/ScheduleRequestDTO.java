package com.lynkvertx.gridpilot.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.lynkvertx.gridpilot.entity.RepeatType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.time.LocalTime;
import java.util.List;

/**
 * New schedule for an appliance; replaces the active one
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleRequestDTO {

    @NotNull(message = "Start time is required")
    @JsonFormat(pattern = "HH:mm")
    private LocalTime startTime;

    @JsonFormat(pattern = "HH:mm")
    private LocalTime endTime;

    private RepeatType repeatType;

    /** ISO days (1 = Monday .. 7 = Sunday), for CUSTOM */
    private List<@Min(1) @Max(7) Integer> customDays;

    /** user or autopilot */
    private String createdBy;
}
